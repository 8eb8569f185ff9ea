package com.healthbud.http;

import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import akka.http.javadsl.Http;
import akka.http.javadsl.ServerBinding;
import akka.http.javadsl.marshallers.jackson.Jackson;
import akka.http.javadsl.model.RemoteAddress;
import akka.http.javadsl.model.RequestEntity;
import akka.http.javadsl.model.StatusCodes;
import akka.http.javadsl.marshalling.Marshaller;
import akka.http.javadsl.server.AllDirectives;
import akka.http.javadsl.server.PathMatchers;
import akka.http.javadsl.server.Route;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthbud.assessment.TriageRequest;
import com.healthbud.http.ApiModels.ChatAssessmentResponse;
import com.healthbud.http.ApiModels.ErrorResponse;
import com.healthbud.http.ApiModels.HealthStatus;
import com.healthbud.messages.Messages.AnalysisCommand;
import com.healthbud.messages.Messages.AnalysisReply;
import com.healthbud.messages.Messages.AnalyzeChat;
import com.healthbud.messages.Messages.Assess;
import com.healthbud.messages.Messages.AssessmentCommand;
import com.healthbud.messages.Messages.AssessmentReply;
import com.healthbud.ratelimit.ClientKeys;
import com.healthbud.ratelimit.SlidingWindowRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * HttpServer - JSON API in front of the assessment and analysis actors.
 * Both chat endpoints are rate limited per client before any actor is involved.
 */
public class HttpServer extends AllDirectives {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String ASSESS_BUCKET = "chat_assess";
    static final String ANALYZE_BUCKET = "chat_analyze";
    static final int WINDOW_SECONDS = 60;
    static final String TOO_MANY_REQUESTS = "Too many requests. Please wait and try again.";

    // longer than the slowest provider timeout plus evidence search
    private static final Duration ASK_TIMEOUT = Duration.ofSeconds(65);

    private final ActorSystem<?> system;
    private final ActorRef<AssessmentCommand> assessmentActor;
    private final ActorRef<AnalysisCommand> analysisActor;
    private final SlidingWindowRateLimiter rateLimiter;
    private final int assessLimitPerMin;
    private final int analyzeLimitPerMin;
    private final ObjectMapper jsonMapper;

    public HttpServer(ActorSystem<?> system, ActorRef<AssessmentCommand> assessmentActor,
                      ActorRef<AnalysisCommand> analysisActor, SlidingWindowRateLimiter rateLimiter,
                      int assessLimitPerMin, int analyzeLimitPerMin, ObjectMapper jsonMapper) {
        this.system = system;
        this.assessmentActor = assessmentActor;
        this.analysisActor = analysisActor;
        this.rateLimiter = rateLimiter;
        this.assessLimitPerMin = assessLimitPerMin;
        this.analyzeLimitPerMin = analyzeLimitPerMin;
        this.jsonMapper = jsonMapper;
    }

    public Route createRoutes() {
        return concat(
            path("health", () ->
                get(() -> completeOK(new HealthStatus("ok"), json()))
            ),

            pathPrefix(PathMatchers.segment("api").slash("v1").slash("chat"), () -> concat(
                path("assess", () ->
                    post(() ->
                        rateLimited(ASSESS_BUCKET, assessLimitPerMin, () ->
                            entity(Jackson.unmarshaller(jsonMapper, TriageRequest.class), this::assess)
                        )
                    )
                ),
                path(PathMatchers.longSegment().slash("analyze"), chatNumber ->
                    post(() ->
                        rateLimited(ANALYZE_BUCKET, analyzeLimitPerMin, () -> analyze(chatNumber))
                    )
                )
            ))
        );
    }

    private Route assess(TriageRequest request) {
        if (request.message.isBlank()) {
            return complete(StatusCodes.BAD_REQUEST, new ErrorResponse("message must not be blank"), json());
        }

        CompletionStage<AssessmentReply> reply = AskPattern.ask(
            assessmentActor,
            replyTo -> new Assess(request, replyTo),
            ASK_TIMEOUT,
            system.scheduler()
        );

        return onComplete(reply, result -> {
            if (result.isSuccess()) {
                AssessmentReply r = result.get();
                return completeOK(new ChatAssessmentResponse(
                    r.chatNumber,
                    r.sessionId,
                    r.timestamp.truncatedTo(ChronoUnit.MILLIS).toString(),
                    r.assessment), json());
            }
            log.error("Assessment did not complete: {}", result.failed().get().getMessage());
            return complete(StatusCodes.SERVICE_UNAVAILABLE,
                new ErrorResponse("Assessment is temporarily unavailable. If this is an emergency, "
                    + "contact emergency services now."), json());
        });
    }

    private Route analyze(long chatNumber) {
        CompletionStage<AnalysisReply> reply = AskPattern.ask(
            analysisActor,
            replyTo -> new AnalyzeChat(chatNumber, replyTo),
            ASK_TIMEOUT,
            system.scheduler()
        );

        return onComplete(reply, result -> {
            if (result.isFailure()) {
                log.error("Analysis of chat #{} did not complete: {}", chatNumber, result.failed().get().getMessage());
                return complete(StatusCodes.SERVICE_UNAVAILABLE,
                    new ErrorResponse("Analysis is temporarily unavailable."), json());
            }
            AnalysisReply r = result.get();
            if (!r.found()) {
                return complete(StatusCodes.NOT_FOUND, new ErrorResponse("Chat " + chatNumber + " not found."), json());
            }
            return completeOK(r.analysis, json());
        });
    }

    /**
     * Admits or rejects before {@code inner} runs. The key is the first X-Forwarded-For entry,
     * else the connection's remote address, else "unknown".
     */
    private Route rateLimited(String bucket, int limitPerMin, Supplier<Route> inner) {
        return optionalHeaderValueByName("X-Forwarded-For", forwardedFor ->
            extractClientIP(remote -> {
                String clientKey = ClientKeys.resolve(forwardedFor.orElse(null), peerAddress(remote));
                if (!rateLimiter.tryAdmit(bucket, clientKey, limitPerMin, WINDOW_SECONDS)) {
                    log.info("Rate limit hit on {} for client {}", bucket, clientKey);
                    return complete(StatusCodes.TOO_MANY_REQUESTS, new ErrorResponse(TOO_MANY_REQUESTS), json());
                }
                return inner.get();
            })
        );
    }

    private static String peerAddress(RemoteAddress remote) {
        return remote.getAddress().map(InetAddress::getHostAddress).orElse(null);
    }

    private <T> Marshaller<T, RequestEntity> json() {
        return Jackson.marshaller(jsonMapper);
    }

    public CompletionStage<ServerBinding> start(String host, int port) {
        return Http.get(system).newServerAt(host, port).bind(createRoutes())
            .thenApply(binding -> {
                log.info("🌐 HealthBud API listening on {}", binding.localAddress());
                return binding;
            });
    }
}
