package com.healthbud;

import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.Behaviors;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthbud.actors.AnalysisActor;
import com.healthbud.actors.AssessmentActor;
import com.healthbud.actors.ChatSessionActor;
import com.healthbud.actors.LoggerActor;
import com.healthbud.analysis.StoredChatAnalyzer;
import com.healthbud.assessment.FallbackTriageEngine;
import com.healthbud.assessment.ResponseNormalizer;
import com.healthbud.assessment.TriageOrchestrator;
import com.healthbud.config.TriageConfig;
import com.healthbud.evidence.WebEvidenceSearch;
import com.healthbud.http.HttpServer;
import com.healthbud.llm.ProviderClient;
import com.healthbud.llm.ProviderClients;
import com.healthbud.messages.Messages.AnalysisCommand;
import com.healthbud.messages.Messages.AssessmentCommand;
import com.healthbud.messages.Messages.LogCommand;
import com.healthbud.messages.Messages.LogEvent;
import com.healthbud.messages.Messages.SessionCommand;
import com.healthbud.ratelimit.SlidingWindowRateLimiter;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * HealthBud triage service - wires the actor system and starts the HTTP API.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        TriageConfig config = new TriageConfig();
        ActorSystem.create(createBehavior(config), "HealthBudTriage");
    }

    public static Behavior<Void> createBehavior(TriageConfig config) {
        return Behaviors.setup(context -> {
            context.getLog().info("🚀 Starting HealthBud triage service: {}", config);
            ActorSystem<Void> system = context.getSystem();

            ObjectMapper jsonMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            OkHttpClient httpClient = new OkHttpClient();
            Clock clock = Clock.systemUTC();

            ProviderClient providerClient = ProviderClients.create(config.providerConfig(), httpClient, jsonMapper);
            TriageOrchestrator orchestrator = TriageOrchestrator.create(providerClient, jsonMapper, config.historyWindow);
            StoredChatAnalyzer analyzer = new StoredChatAnalyzer(
                providerClient,
                new WebEvidenceSearch(httpClient, config.webSearchEnabled, config.webSearchMaxResults,
                    config.trustedMedicalDomains),
                new ResponseNormalizer(jsonMapper),
                new FallbackTriageEngine(),
                jsonMapper,
                clock);

            ActorRef<LogCommand> logger = context.spawn(LoggerActor.create(), "logger");
            ActorRef<SessionCommand> sessions = context.spawn(
                ChatSessionActor.create(logger, config.historyWindow, clock), "chat-sessions");
            ActorRef<AssessmentCommand> assessment = context.spawn(
                AssessmentActor.create(orchestrator, sessions, logger), "assessment");
            ActorRef<AnalysisCommand> analysis = context.spawn(
                AnalysisActor.create(analyzer, sessions, logger), "analysis");

            logger.tell(new LogEvent("SYSTEM", "Main", "All actors initialized"));

            HttpServer httpServer = new HttpServer(system, assessment, analysis,
                new SlidingWindowRateLimiter(clock), config.assessRateLimitPerMin, config.analyzeRateLimitPerMin,
                jsonMapper);
            httpServer.start(config.httpHost, config.httpPort)
                .whenComplete((binding, throwable) -> {
                    if (throwable != null) {
                        log.error("❌ HTTP server failed to start", throwable);
                        system.terminate();
                    } else {
                        logger.tell(new LogEvent("SYSTEM", "HttpServer",
                            "Listening on " + binding.localAddress()));
                    }
                });

            return Behaviors.empty();
        });
    }
}
