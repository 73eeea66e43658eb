package com.elssolution.insteonbridge.alerts;

import com.elssolution.insteonbridge.service.BridgeStatusTracker;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    private static final String GATEWAY_PACKAGE = "com.elssolution.insteonbridge.gateway";
    private static final String MOCK_PACKAGE = "com.elssolution.insteonbridge.mock";

    private final BridgeStatusTracker status;
    private final ApplicationEventPublisher publisher;

    private volatile boolean stopping = false; // mute noise while shutting down

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;

        log.error("Uncaught in {} -> {}", t.getName(), e.toString(), e);
        status.recordError(e.toString());

        // A dead driver thread leaves the PLM link half-open: have the supervisor reconnect
        if (isGatewayFailure(t, e)) {
            publisher.publishEvent(new GatewayCrashedEvent(e));
        }
    }

    static boolean isGatewayFailure(Thread t, Throwable e) {
        String name = (t.getName() == null ? "" : t.getName());
        if (name.startsWith("insteon-connect") || name.contains("PLM") || name.contains("SerialPort")) {
            return true;
        }
        for (Throwable c = e; c != null; c = c.getCause()) {
            for (StackTraceElement st : c.getStackTrace()) {
                String cls = st.getClassName();
                if (cls.startsWith(GATEWAY_PACKAGE) || cls.startsWith(MOCK_PACKAGE)
                        || cls.startsWith("com.fazecast.jSerialComm")) {
                    return true;
                }
            }
            if (c.getCause() == c) break;
        }
        return false;
    }
}
