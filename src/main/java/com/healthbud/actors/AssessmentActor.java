package com.healthbud.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.healthbud.assessment.ConversationTurn;
import com.healthbud.assessment.TriageAssessment;
import com.healthbud.assessment.TriageOrchestrator;
import com.healthbud.assessment.TriageRequest;
import com.healthbud.messages.Messages.Assess;
import com.healthbud.messages.Messages.AssessmentCommand;
import com.healthbud.messages.Messages.AssessmentReply;
import com.healthbud.messages.Messages.ChatRecorded;
import com.healthbud.messages.Messages.ConversationHistory;
import com.healthbud.messages.Messages.GetConversationHistory;
import com.healthbud.messages.Messages.LogCommand;
import com.healthbud.messages.Messages.LogEvent;
import com.healthbud.messages.Messages.RecordChat;
import com.healthbud.messages.Messages.SessionCommand;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;

/**
 * AssessmentActor - one assessment per {@link Assess} message.
 *
 * <p>Flow: load the session transcript (ask), run the orchestrator on the blocking dispatcher
 * (pipeToSelf), store the turn (ask), reply. The provider call can take tens of seconds, so it
 * never runs on the actor's own thread. A turn still running at the deadline is cancelled: the
 * worker is interrupted, which abandons the HTTP call, and the rule-based answer is sent instead.
 */
public class AssessmentActor extends AbstractBehavior<AssessmentCommand> {

    public static final String BLOCKING_DISPATCHER = "healthbud.blocking-dispatcher";

    // shorter than the HTTP layer's ask timeout so the caller still gets an answer
    public static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(60);

    private static final Duration SESSION_TIMEOUT = Duration.ofSeconds(5);

    private final TriageOrchestrator orchestrator;
    private final ActorRef<SessionCommand> sessions;
    private final ActorRef<LogCommand> logger;
    private final Executor blockingExecutor;
    private final Duration deadline;

    public static Behavior<AssessmentCommand> create(TriageOrchestrator orchestrator,
                                                     ActorRef<SessionCommand> sessions,
                                                     ActorRef<LogCommand> logger) {
        return create(orchestrator, sessions, logger, DispatcherSelector.fromConfig(BLOCKING_DISPATCHER),
            DEFAULT_DEADLINE);
    }

    public static Behavior<AssessmentCommand> create(TriageOrchestrator orchestrator,
                                                     ActorRef<SessionCommand> sessions,
                                                     ActorRef<LogCommand> logger,
                                                     DispatcherSelector blockingDispatcher,
                                                     Duration deadline) {
        return Behaviors.setup(context -> new AssessmentActor(context, orchestrator, sessions, logger,
            context.getSystem().dispatchers().lookup(blockingDispatcher), deadline));
    }

    private AssessmentActor(ActorContext<AssessmentCommand> context, TriageOrchestrator orchestrator,
                            ActorRef<SessionCommand> sessions, ActorRef<LogCommand> logger,
                            Executor blockingExecutor, Duration deadline) {
        super(context);
        this.orchestrator = orchestrator;
        this.sessions = sessions;
        this.logger = logger;
        this.blockingExecutor = blockingExecutor;
        this.deadline = deadline;

        getContext().getLog().info("🤖 AssessmentActor initialized, provider {}",
            orchestrator.isProviderEnabled() ? "enabled" : "disabled (rule-based fallback only)");
    }

    @Override
    public Receive<AssessmentCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(Assess.class, this::onAssess)
                .onMessage(HistoryLoaded.class, this::onHistoryLoaded)
                .onMessage(DeadlineReached.class, this::onDeadlineReached)
                .onMessage(AssessmentCompleted.class, this::onAssessmentCompleted)
                .onMessage(ChatStored.class, this::onChatStored)
                .build();
    }

    private Behavior<AssessmentCommand> onAssess(Assess msg) {
        String sessionId = msg.request.sessionId == null || msg.request.sessionId.isBlank()
            ? UUID.randomUUID().toString()
            : msg.request.sessionId;
        TriageRequest request = msg.request.withSessionId(sessionId);

        logger.tell(new LogEvent(sessionId, "AssessmentActor",
            "Assessment requested (" + request.symptoms.size() + " structured symptoms)"));

        getContext().ask(
            ConversationHistory.class,
            sessions,
            SESSION_TIMEOUT,
            replyTo -> new GetConversationHistory(sessionId, replyTo),
            (history, failure) -> {
                if (failure != null) {
                    getContext().getLog().warn("History lookup for session [{}] failed: {}",
                        sessionId, failure.getMessage());
                    return new HistoryLoaded(request, List.of(), msg.replyTo);
                }
                return new HistoryLoaded(request, history.turns, msg.replyTo);
            });
        return this;
    }

    private Behavior<AssessmentCommand> onHistoryLoaded(HistoryLoaded msg) {
        CompletableFuture<TriageAssessment> result = new CompletableFuture<>();
        FutureTask<TriageAssessment> task = new FutureTask<TriageAssessment>(
            () -> orchestrator.assess(msg.request, msg.history)) {
            @Override
            protected void done() {
                try {
                    result.complete(get());
                } catch (CancellationException e) {
                    result.completeExceptionally(e);
                } catch (ExecutionException e) {
                    result.completeExceptionally(e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    result.completeExceptionally(e);
                }
            }
        };
        blockingExecutor.execute(task);
        getContext().scheduleOnce(deadline, getContext().getSelf(), new DeadlineReached(msg.request.sessionId, task));

        getContext().pipeToSelf(result, (assessment, failure) -> {
            if (failure != null) {
                if (failure instanceof CancellationException) {
                    getContext().getLog().warn("Assessment for session [{}] passed its {}s deadline; using fallback",
                        msg.request.sessionId, deadline.toSeconds());
                } else {
                    getContext().getLog().error("Assessment task for session [{}] failed; using fallback",
                        msg.request.sessionId, failure);
                }
                return new AssessmentCompleted(msg.request,
                    orchestrator.fallbackAssessment(msg.request, msg.history), msg.replyTo);
            }
            return new AssessmentCompleted(msg.request, assessment, msg.replyTo);
        });
        return this;
    }

    private Behavior<AssessmentCommand> onDeadlineReached(DeadlineReached msg) {
        // no-op when the task already finished
        if (msg.task.cancel(true)) {
            logger.tell(new LogEvent(msg.sessionId, "AssessmentActor", "Provider call abandoned at deadline", "WARN"));
        }
        return this;
    }

    private Behavior<AssessmentCommand> onAssessmentCompleted(AssessmentCompleted msg) {
        getContext().ask(
            ChatRecorded.class,
            sessions,
            SESSION_TIMEOUT,
            replyTo -> new RecordChat(msg.request, msg.assessment, replyTo),
            (recorded, failure) -> {
                if (failure != null) {
                    getContext().getLog().error("Could not store chat for session [{}]: {}",
                        msg.request.sessionId, failure.getMessage());
                    return new ChatStored(msg.request, msg.assessment, 0L, Instant.now(), msg.replyTo);
                }
                return new ChatStored(msg.request, msg.assessment, recorded.chatNumber, recorded.recordedAt,
                    msg.replyTo);
            });
        return this;
    }

    private Behavior<AssessmentCommand> onChatStored(ChatStored msg) {
        msg.replyTo.tell(new AssessmentReply(msg.chatNumber, msg.request.sessionId, msg.recordedAt, msg.assessment));
        logger.tell(new LogEvent(msg.request.sessionId, "AssessmentActor",
            "Chat #" + msg.chatNumber + " assessed: urgency " + msg.assessment.urgencyLevel.token()
                + (msg.assessment.showStructuredOutput ? "" : " (conversational)")));
        return this;
    }

    // ========== INTERNAL MESSAGES ==========

    private static final class HistoryLoaded implements AssessmentCommand {
        final TriageRequest request;
        final List<ConversationTurn> history;
        final ActorRef<AssessmentReply> replyTo;

        HistoryLoaded(TriageRequest request, List<ConversationTurn> history, ActorRef<AssessmentReply> replyTo) {
            this.request = request;
            this.history = history;
            this.replyTo = replyTo;
        }
    }

    private static final class DeadlineReached implements AssessmentCommand {
        final String sessionId;
        final FutureTask<TriageAssessment> task;

        DeadlineReached(String sessionId, FutureTask<TriageAssessment> task) {
            this.sessionId = sessionId;
            this.task = task;
        }
    }

    private static final class AssessmentCompleted implements AssessmentCommand {
        final TriageRequest request;
        final TriageAssessment assessment;
        final ActorRef<AssessmentReply> replyTo;

        AssessmentCompleted(TriageRequest request, TriageAssessment assessment, ActorRef<AssessmentReply> replyTo) {
            this.request = request;
            this.assessment = assessment;
            this.replyTo = replyTo;
        }
    }

    private static final class ChatStored implements AssessmentCommand {
        final TriageRequest request;
        final TriageAssessment assessment;
        final long chatNumber;
        final Instant recordedAt;
        final ActorRef<AssessmentReply> replyTo;

        ChatStored(TriageRequest request, TriageAssessment assessment, long chatNumber, Instant recordedAt,
                   ActorRef<AssessmentReply> replyTo) {
            this.request = request;
            this.assessment = assessment;
            this.chatNumber = chatNumber;
            this.recordedAt = recordedAt;
            this.replyTo = replyTo;
        }
    }
}
