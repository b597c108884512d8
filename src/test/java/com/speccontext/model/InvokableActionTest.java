package com.speccontext.model;

import org.testng.annotations.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the single-invocation guard shared by slots and conditions.
 */
public class InvokableActionTest {

    @Test
    public void invoke_runsTheActionOnce() {
        AtomicInteger counter = new AtomicInteger();
        InvokableAction action = new InvokableAction(counter::incrementAndGet);

        action.invoke();
        action.invoke();

        assertThat(counter.get()).isEqualTo(1);
        assertThat(action.isInvoked()).isTrue();
    }

    @Test
    public void invoke_wrapsWhatTheActionThrows() {
        IOException boom = new IOException("disk unplugged");
        InvokableAction action = new InvokableAction(() -> { throw boom; });

        assertThatThrownBy(action::invoke)
            .isInstanceOf(ActionInvocationException.class)
            .hasCause(boom)
            .hasMessageContaining("disk unplugged");
    }

    @Test
    public void invoke_doesNotRetryAFailedAction() {
        AtomicInteger counter = new AtomicInteger();
        InvokableAction action = new InvokableAction(() -> {
            counter.incrementAndGet();
            throw new IllegalStateException("first call fails");
        });

        assertThatThrownBy(action::invoke).isInstanceOf(ActionInvocationException.class);
        action.invoke();

        assertThat(counter.get()).isEqualTo(1);
    }

    @Test
    public void invoke_toleratesAnUndefinedAction() {
        InvokableAction action = new InvokableAction(null);

        action.invoke();

        assertThat(action.isDefined()).isFalse();
        assertThat(action.isInvoked()).isTrue();
    }

    @Test
    public void isDefinedBy_comparesByIdentity() {
        SpecAction body = () -> { };
        InvokableAction action = new InvokableAction(body);

        assertThat(action.isDefinedBy(body)).isTrue();
        assertThat(action.isDefinedBy(SpecAction.PENDING)).isFalse();
        assertThat(new InvokableAction(SpecAction.PENDING).isDefinedBy(SpecAction.PENDING)).isTrue();
    }
}
