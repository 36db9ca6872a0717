package com.lintmux.core.relay;

import com.lintmux.child.ChildFailure;
import com.lintmux.child.ChildLink;
import com.lintmux.child.ChildNotification;
import com.lintmux.child.LinkListener;
import com.lintmux.core.events.HostNotification;
import com.lintmux.core.events.NotificationBus;
import com.lintmux.core.logging.MdcContext;
import com.lintmux.core.metrics.LintmuxMetrics;
import com.lintmux.core.model.AnalysisErrors;
import com.lintmux.core.model.Diagnostic;
import com.lintmux.core.model.LinkState;
import com.lintmux.core.scheduler.OrchestratorLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Forwards what READY children emit to the host.
 *
 * <p>Four subscriptions per link, made as soon as its connection opens and
 * owned by the link so disposal cancels them: diagnostics (merged across
 * children and only sent when the merged value changed), log output
 * (relabelled with the child's name), internal errors (sent as plugin errors)
 * and every other notification verbatim. Events are handed over to the
 * orchestrator loop before being processed. What a child emits during its
 * handshake is held back and replayed in order once it turns READY, or
 * discarded if the handshake fails; events still queued when their link is
 * disposed are dropped.
 */
@Component
public class NotificationRelay implements LinkListener {

    private static final Logger log = LoggerFactory.getLogger(NotificationRelay.class);

    /** Kinds relayed through their dedicated stream. */
    static final Set<String> HANDLED_METHODS = Set.of(
            HostNotification.DIAGNOSTICS_METHOD,
            HostNotification.PRINT_METHOD);

    private final OrchestratorLoop loop;
    private final NotificationBus notificationBus;
    private final LintmuxMetrics metrics;
    private final DiagnosticsAggregator diagnostics = new DiagnosticsAggregator();

    /** Events of links still handshaking, in arrival order. */
    private final Map<ChildLink, List<Runnable>> held = new HashMap<>();

    public NotificationRelay(OrchestratorLoop loop, NotificationBus notificationBus,
                             @Autowired(required = false) LintmuxMetrics metrics) {
        this.loop = loop;
        this.notificationBus = notificationBus;
        this.metrics = metrics;
    }

    @Override
    public void linkStarted(ChildLink link) {
        held.put(link, new ArrayList<>());
        var connection = link.connection();
        link.own(connection.onDiagnostics(onLoop(link, errors -> relayDiagnostics(link, errors))));
        link.own(connection.onLog(onLoop(link, text -> relayLog(link, text))));
        link.own(connection.onError(onLoop(link, failure -> relayError(link, failure))));
        link.own(connection.onNotification(onLoop(link, notification -> relayNotification(notification))));
        log.debug("Relaying notifications of plugin {}", link.name());
    }

    @Override
    public void linkReady(ChildLink link) {
        diagnostics.register(link.identity());
        List<Runnable> events = held.remove(link);
        if (events != null && !events.isEmpty()) {
            log.debug("Replaying {} events plugin {} sent during its handshake", events.size(), link.name());
            events.forEach(Runnable::run);
        }
    }

    @Override
    public void linkFailed(ChildLink link) {
        List<Runnable> events = held.remove(link);
        if (events != null && !events.isEmpty()) {
            log.debug("Dropping {} events of plugin {} whose handshake failed", events.size(), link.name());
        }
    }

    /**
     * Withdraws the child's diagnostics, sending the resulting merged value of
     * every file it had reported on.
     */
    @Override
    public void linkDisposed(ChildLink link) {
        held.remove(link);
        diagnostics.withdraw(link.identity()).forEach((file, merged) -> {
            if (metrics != null) {
                metrics.recordDiagnosticsUpdate(true);
            }
            publishDiagnostics(file, merged);
        });
    }

    /** Current merged diagnostics of {@code file}. */
    public List<Diagnostic> mergedDiagnostics(String file) {
        return diagnostics.merged(file);
    }

    public void reset() {
        held.clear();
        diagnostics.clear();
    }

    private <T> Consumer<T> onLoop(ChildLink link, Consumer<T> handler) {
        return event -> loop.execute(() -> {
            if (link.isReady()) {
                dispatch(link, handler, event);
                return;
            }
            List<Runnable> events = held.get(link);
            if (events != null && link.state() == LinkState.STARTING) {
                events.add(() -> dispatch(link, handler, event));
            }
        });
    }

    private <T> void dispatch(ChildLink link, Consumer<T> handler, T event) {
        MdcContext.setChild(link.identity(), link.name());
        try {
            handler.accept(event);
        } finally {
            MdcContext.clearChild();
        }
    }

    void relayDiagnostics(ChildLink link, AnalysisErrors errors) {
        if (errors.file() == null) {
            log.warn("Plugin {} reported diagnostics without a file", link.name());
            return;
        }
        var changed = diagnostics.update(link.identity(), errors.file(), errors.errors());
        if (metrics != null) {
            metrics.recordDiagnosticsUpdate(changed.isPresent());
        }
        changed.ifPresent(merged -> publishDiagnostics(errors.file(), merged));
    }

    void relayLog(ChildLink link, String text) {
        record("print");
        notificationBus.publish(new HostNotification.Print(label(link.name(), text)));
    }

    void relayError(ChildLink link, ChildFailure failure) {
        record("error");
        log.warn("Plugin {} reported an error: {}", link.name(), failure.message());
        notificationBus.publish(new HostNotification.PluginError(link.identity(),
                "The plugin " + link.name() + " reported an error: " + failure.message(),
                failure.stackTrace()));
    }

    void relayNotification(ChildNotification notification) {
        if (notification.method() == null || HANDLED_METHODS.contains(notification.method())) {
            return;
        }
        record("passthrough");
        notificationBus.publish(new HostNotification.Passthrough(notification.method(), notification.params()));
    }

    /**
     * Prefixes every line of {@code text} with {@code [name]}; an empty line
     * becomes the bare label.
     */
    static String label(String name, String text) {
        String prefix = "[" + name + "]";
        var labelled = new StringBuilder();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) labelled.append('\n');
            labelled.append(lines[i].isEmpty() ? prefix : prefix + " " + lines[i]);
        }
        return labelled.toString();
    }

    private void publishDiagnostics(String file, List<Diagnostic> merged) {
        notificationBus.publish(new HostNotification.DiagnosticsChanged(file, merged));
    }

    private void record(String kind) {
        if (metrics != null) {
            metrics.recordRelayedNotification(kind);
        }
    }
}
