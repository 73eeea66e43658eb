package com.elssolution.insteonbridge.alerts;

import com.elssolution.insteonbridge.config.BridgeSettings;
import com.elssolution.insteonbridge.service.BridgeStatusTracker;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextClosedEvent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class GlobalUncaughtHandlerTest {

    private final BridgeStatusTracker status = new BridgeStatusTracker(new BridgeSettings());
    private final ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
    private final GlobalUncaughtHandler handler = new GlobalUncaughtHandler(status, publisher);

    private static Throwable thrownFrom(String className) {
        Throwable e = new IllegalStateException("reader died");
        e.setStackTrace(new StackTraceElement[]{
                new StackTraceElement(className, "run", "X.java", 42)});
        return e;
    }

    @Test
    void gatewayThreadDeathAsksForReconnect() {
        Throwable e = thrownFrom("com.elssolution.insteonbridge.gateway.SomeDriverReader");

        handler.uncaughtException(new Thread("worker-1"), e);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publishEvent(captor.capture());
        assertThat(captor.getValue()).isInstanceOfSatisfying(GatewayCrashedEvent.class,
                evt -> assertThat(evt.cause()).isSameAs(e));
        assertThat(status.lastError()).contains("reader died");
    }

    @Test
    void unrelatedFailureIsOnlyRecorded() {
        handler.uncaughtException(new Thread("worker-2"), thrownFrom("org.example.Other"));

        verify(publisher, never()).publishEvent(any(Object.class));
        assertThat(status.lastError()).isNotNull();
    }

    @Test
    void silentAfterContextClose() {
        handler.onContextClosed(mock(ContextClosedEvent.class));

        handler.uncaughtException(new Thread("insteon-connect-1"), new IllegalStateException("late"));

        verify(publisher, never()).publishEvent(any(Object.class));
        assertThat(status.lastError()).isNull();
    }
}
