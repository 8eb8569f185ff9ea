package com.healthbud.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.healthbud.analysis.StoredChat;
import com.healthbud.assessment.ConversationTurn;
import com.healthbud.messages.Messages.ChatRecorded;
import com.healthbud.messages.Messages.ConversationHistory;
import com.healthbud.messages.Messages.GetConversationHistory;
import com.healthbud.messages.Messages.GetStoredChat;
import com.healthbud.messages.Messages.LogCommand;
import com.healthbud.messages.Messages.LogEvent;
import com.healthbud.messages.Messages.RecordChat;
import com.healthbud.messages.Messages.SessionCommand;
import com.healthbud.messages.Messages.StoredChatLookup;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ChatSessionActor - in-memory chat store.
 * Numbers every assessed turn, keeps a bounded per-session transcript for prompt context, and
 * serves stored chats back for re-analysis. State is only touched from the actor's own thread.
 */
public class ChatSessionActor extends AbstractBehavior<SessionCommand> {

    private final ActorRef<LogCommand> logger;
    private final Clock clock;
    private final int historyWindow;
    private final Map<String, Deque<ConversationTurn>> transcripts = new HashMap<>();
    private final Map<Long, StoredChat> chats = new HashMap<>();
    private long nextChatNumber = 1;

    public static Behavior<SessionCommand> create(ActorRef<LogCommand> logger, int historyWindow) {
        return create(logger, historyWindow, Clock.systemUTC());
    }

    public static Behavior<SessionCommand> create(ActorRef<LogCommand> logger, int historyWindow, Clock clock) {
        return Behaviors.setup(context -> new ChatSessionActor(context, logger, historyWindow, clock));
    }

    private ChatSessionActor(ActorContext<SessionCommand> context, ActorRef<LogCommand> logger,
                             int historyWindow, Clock clock) {
        super(context);
        this.logger = logger;
        this.clock = clock;
        this.historyWindow = Math.max(0, historyWindow);

        getContext().getLog().info("👥 ChatSessionActor initialized (history window {})", this.historyWindow);
    }

    @Override
    public Receive<SessionCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(RecordChat.class, this::onRecordChat)
                .onMessage(GetConversationHistory.class, this::onGetConversationHistory)
                .onMessage(GetStoredChat.class, this::onGetStoredChat)
                .build();
    }

    private Behavior<SessionCommand> onRecordChat(RecordChat msg) {
        long chatNumber = nextChatNumber++;
        Instant now = clock.instant();
        chats.put(chatNumber, StoredChat.from(chatNumber, msg.request, now));

        String sessionId = msg.request.sessionId;
        if (historyWindow > 0 && sessionId != null) {
            Deque<ConversationTurn> turns = transcripts.computeIfAbsent(sessionId, k -> new ArrayDeque<>());
            turns.addLast(new ConversationTurn(msg.request.message, msg.assessment.assistantMessage));
            while (turns.size() > historyWindow) {
                turns.removeFirst();
            }
        }

        msg.replyTo.tell(new ChatRecorded(chatNumber, now));
        logger.tell(new LogEvent(sessionId, "ChatSessionActor",
            "Stored chat #" + chatNumber + " (urgency " + msg.assessment.urgencyLevel.token() + ")", "DEBUG"));
        return this;
    }

    private Behavior<SessionCommand> onGetConversationHistory(GetConversationHistory msg) {
        Deque<ConversationTurn> turns = msg.sessionId == null ? null : transcripts.get(msg.sessionId);
        List<ConversationTurn> copy = turns == null ? List.of() : new ArrayList<>(turns);
        msg.replyTo.tell(new ConversationHistory(msg.sessionId, copy));
        return this;
    }

    private Behavior<SessionCommand> onGetStoredChat(GetStoredChat msg) {
        StoredChat chat = chats.get(msg.chatNumber);
        if (chat == null) {
            getContext().getLog().debug("👥 Chat #{} not found", msg.chatNumber);
        }
        msg.replyTo.tell(new StoredChatLookup(msg.chatNumber, chat));
        return this;
    }
}
