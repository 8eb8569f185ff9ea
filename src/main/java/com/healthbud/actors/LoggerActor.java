package com.healthbud.actors;

import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.healthbud.messages.Messages.LogCommand;
import com.healthbud.messages.Messages.LogEvent;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * LoggerActor - audit trail for chat activity.
 * Fire-and-forget: other actors tell it what happened, it writes one line per event.
 */
public class LoggerActor extends AbstractBehavior<LogCommand> {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private long eventCount;

    public static Behavior<LogCommand> create() {
        return Behaviors.setup(LoggerActor::new);
    }

    private LoggerActor(ActorContext<LogCommand> context) {
        super(context);
        getContext().getLog().info("📝 LoggerActor initialized");
    }

    @Override
    public Receive<LogCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(LogEvent.class, this::onLogEvent)
                .build();
    }

    private Behavior<LogCommand> onLogEvent(LogEvent msg) {
        eventCount++;
        String level = msg.level == null ? "INFO" : msg.level.toUpperCase(Locale.ROOT);
        String line = String.format("[%s] #%d | Session: %s | %s: %s",
            TIMESTAMP_FORMAT.format(msg.timestamp), eventCount, msg.sessionId, msg.actorName, msg.event);

        switch (level) {
            case "ERROR":
                getContext().getLog().error("❌ {}", line);
                break;
            case "WARN":
            case "WARNING":
                getContext().getLog().warn("⚠️ {}", line);
                break;
            case "DEBUG":
                getContext().getLog().debug("🔍 {}", line);
                break;
            default:
                getContext().getLog().info(line);
        }
        return this;
    }
}
