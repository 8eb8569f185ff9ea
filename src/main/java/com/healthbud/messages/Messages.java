package com.healthbud.messages;

import akka.actor.typed.ActorRef;
import com.healthbud.analysis.StoredChat;
import com.healthbud.analysis.StoredChatAnalysis;
import com.healthbud.assessment.ConversationTurn;
import com.healthbud.assessment.TriageAssessment;
import com.healthbud.assessment.TriageRequest;

import java.time.Instant;
import java.util.List;

/**
 * Centralized message definitions for the triage actors.
 */
public class Messages {

    // ========== ASSESSMENT MESSAGES ==========
    public interface AssessmentCommand {}

    public static class Assess implements AssessmentCommand {
        public final TriageRequest request;
        public final ActorRef<AssessmentReply> replyTo;

        public Assess(TriageRequest request, ActorRef<AssessmentReply> replyTo) {
            this.request = request;
            this.replyTo = replyTo;
        }
    }

    public static class AssessmentReply {
        public final long chatNumber;
        public final String sessionId;
        public final Instant timestamp;
        public final TriageAssessment assessment;

        public AssessmentReply(long chatNumber, String sessionId, Instant timestamp, TriageAssessment assessment) {
            this.chatNumber = chatNumber;
            this.sessionId = sessionId;
            this.timestamp = timestamp;
            this.assessment = assessment;
        }
    }

    // ========== STORED CHAT ANALYSIS MESSAGES ==========
    public interface AnalysisCommand {}

    public static class AnalyzeChat implements AnalysisCommand {
        public final long chatNumber;
        public final ActorRef<AnalysisReply> replyTo;

        public AnalyzeChat(long chatNumber, ActorRef<AnalysisReply> replyTo) {
            this.chatNumber = chatNumber;
            this.replyTo = replyTo;
        }
    }

    public static class AnalysisReply {
        public final long chatNumber;
        public final StoredChatAnalysis analysis;   // null when the chat is unknown

        public AnalysisReply(long chatNumber, StoredChatAnalysis analysis) {
            this.chatNumber = chatNumber;
            this.analysis = analysis;
        }

        public boolean found() {
            return analysis != null;
        }
    }

    // ========== SESSION MESSAGES ==========
    public interface SessionCommand {}

    public static class RecordChat implements SessionCommand {
        public final TriageRequest request;
        public final TriageAssessment assessment;
        public final ActorRef<ChatRecorded> replyTo;

        public RecordChat(TriageRequest request, TriageAssessment assessment, ActorRef<ChatRecorded> replyTo) {
            this.request = request;
            this.assessment = assessment;
            this.replyTo = replyTo;
        }
    }

    public static class ChatRecorded {
        public final long chatNumber;
        public final Instant recordedAt;

        public ChatRecorded(long chatNumber, Instant recordedAt) {
            this.chatNumber = chatNumber;
            this.recordedAt = recordedAt;
        }
    }

    public static class GetConversationHistory implements SessionCommand {
        public final String sessionId;
        public final ActorRef<ConversationHistory> replyTo;

        public GetConversationHistory(String sessionId, ActorRef<ConversationHistory> replyTo) {
            this.sessionId = sessionId;
            this.replyTo = replyTo;
        }
    }

    public static class ConversationHistory {
        public final String sessionId;
        public final List<ConversationTurn> turns;   // oldest first

        public ConversationHistory(String sessionId, List<ConversationTurn> turns) {
            this.sessionId = sessionId;
            this.turns = List.copyOf(turns);
        }
    }

    public static class GetStoredChat implements SessionCommand {
        public final long chatNumber;
        public final ActorRef<StoredChatLookup> replyTo;

        public GetStoredChat(long chatNumber, ActorRef<StoredChatLookup> replyTo) {
            this.chatNumber = chatNumber;
            this.replyTo = replyTo;
        }
    }

    public static class StoredChatLookup {
        public final long chatNumber;
        public final StoredChat chat;   // null when unknown

        public StoredChatLookup(long chatNumber, StoredChat chat) {
            this.chatNumber = chatNumber;
            this.chat = chat;
        }
    }

    // ========== LOGGING MESSAGES ==========
    public interface LogCommand {}

    public static class LogEvent implements LogCommand {
        public final String sessionId;
        public final String actorName;
        public final String event;
        public final String level;
        public final Instant timestamp;

        public LogEvent(String sessionId, String actorName, String event, String level) {
            this.sessionId = sessionId;
            this.actorName = actorName;
            this.event = event;
            this.level = level;
            this.timestamp = Instant.now();
        }

        public LogEvent(String sessionId, String actorName, String event) {
            this(sessionId, actorName, event, "INFO");
        }
    }
}
