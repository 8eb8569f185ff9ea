package com.healthbud.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.healthbud.analysis.StoredChat;
import com.healthbud.analysis.StoredChatAnalysis;
import com.healthbud.analysis.StoredChatAnalyzer;
import com.healthbud.messages.Messages.AnalysisCommand;
import com.healthbud.messages.Messages.AnalysisReply;
import com.healthbud.messages.Messages.AnalyzeChat;
import com.healthbud.messages.Messages.GetStoredChat;
import com.healthbud.messages.Messages.LogCommand;
import com.healthbud.messages.Messages.LogEvent;
import com.healthbud.messages.Messages.SessionCommand;
import com.healthbud.messages.Messages.StoredChatLookup;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * AnalysisActor - evidence-grounded re-analysis of a stored chat.
 * Looks the chat up in the session store, then runs search and model work on the blocking dispatcher.
 */
public class AnalysisActor extends AbstractBehavior<AnalysisCommand> {

    private static final Duration SESSION_TIMEOUT = Duration.ofSeconds(5);

    private final StoredChatAnalyzer analyzer;
    private final ActorRef<SessionCommand> sessions;
    private final ActorRef<LogCommand> logger;
    private final Executor blockingExecutor;

    public static Behavior<AnalysisCommand> create(StoredChatAnalyzer analyzer,
                                                   ActorRef<SessionCommand> sessions,
                                                   ActorRef<LogCommand> logger) {
        return create(analyzer, sessions, logger, DispatcherSelector.fromConfig(AssessmentActor.BLOCKING_DISPATCHER));
    }

    public static Behavior<AnalysisCommand> create(StoredChatAnalyzer analyzer,
                                                   ActorRef<SessionCommand> sessions,
                                                   ActorRef<LogCommand> logger,
                                                   DispatcherSelector blockingDispatcher) {
        return Behaviors.setup(context -> new AnalysisActor(context, analyzer, sessions, logger,
            context.getSystem().dispatchers().lookup(blockingDispatcher)));
    }

    private AnalysisActor(ActorContext<AnalysisCommand> context, StoredChatAnalyzer analyzer,
                          ActorRef<SessionCommand> sessions, ActorRef<LogCommand> logger,
                          Executor blockingExecutor) {
        super(context);
        this.analyzer = analyzer;
        this.sessions = sessions;
        this.logger = logger;
        this.blockingExecutor = blockingExecutor;

        getContext().getLog().info("🔍 AnalysisActor initialized");
    }

    @Override
    public Receive<AnalysisCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(AnalyzeChat.class, this::onAnalyzeChat)
                .onMessage(ChatLoaded.class, this::onChatLoaded)
                .onMessage(AnalysisCompleted.class, this::onAnalysisCompleted)
                .build();
    }

    private Behavior<AnalysisCommand> onAnalyzeChat(AnalyzeChat msg) {
        getContext().ask(
            StoredChatLookup.class,
            sessions,
            SESSION_TIMEOUT,
            replyTo -> new GetStoredChat(msg.chatNumber, replyTo),
            (lookup, failure) -> {
                if (failure != null) {
                    getContext().getLog().warn("Stored chat #{} lookup failed: {}", msg.chatNumber, failure.getMessage());
                    return new ChatLoaded(msg.chatNumber, null, msg.replyTo);
                }
                return new ChatLoaded(msg.chatNumber, lookup.chat, msg.replyTo);
            });
        return this;
    }

    private Behavior<AnalysisCommand> onChatLoaded(ChatLoaded msg) {
        if (msg.chat == null) {
            msg.replyTo.tell(new AnalysisReply(msg.chatNumber, null));
            return this;
        }

        StoredChat chat = msg.chat;
        logger.tell(new LogEvent(chat.sessionId, "AnalysisActor",
            "Re-analyzing chat #" + chat.chatNumber + " with " + chat.symptoms.size() + " symptoms"));

        CompletableFuture<StoredChatAnalysis> future =
            CompletableFuture.supplyAsync(() -> analyzer.analyze(chat), blockingExecutor);
        getContext().pipeToSelf(future, (analysis, failure) -> {
            if (failure != null) {
                getContext().getLog().error("Analysis task for chat #{} failed; using fallback", chat.chatNumber, failure);
                return new AnalysisCompleted(chat, analyzer.fallbackAnalysis(chat), msg.replyTo);
            }
            return new AnalysisCompleted(chat, analysis, msg.replyTo);
        });
        return this;
    }

    private Behavior<AnalysisCommand> onAnalysisCompleted(AnalysisCompleted msg) {
        logger.tell(new LogEvent(msg.chat.sessionId, "AnalysisActor",
            "Chat #" + msg.chat.chatNumber + " analyzed: urgency " + msg.analysis.urgencyLevel.token()
                + ", " + msg.analysis.conditions.size() + " evidence-backed conditions"));
        msg.replyTo.tell(new AnalysisReply(msg.chat.chatNumber, msg.analysis));
        return this;
    }

    private static final class ChatLoaded implements AnalysisCommand {
        final long chatNumber;
        final StoredChat chat;
        final ActorRef<AnalysisReply> replyTo;

        ChatLoaded(long chatNumber, StoredChat chat, ActorRef<AnalysisReply> replyTo) {
            this.chatNumber = chatNumber;
            this.chat = chat;
            this.replyTo = replyTo;
        }
    }

    private static final class AnalysisCompleted implements AnalysisCommand {
        final StoredChat chat;
        final StoredChatAnalysis analysis;
        final ActorRef<AnalysisReply> replyTo;

        AnalysisCompleted(StoredChat chat, StoredChatAnalysis analysis, ActorRef<AnalysisReply> replyTo) {
            this.chat = chat;
            this.analysis = analysis;
            this.replyTo = replyTo;
        }
    }
}
