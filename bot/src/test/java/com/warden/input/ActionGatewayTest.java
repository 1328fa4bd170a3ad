package com.warden.input;

import com.warden.config.BotConfig;
import com.warden.timing.BoundedCall;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class ActionGatewayTest {

    @Mock
    private ActionPort port;

    private AutoCloseable mocks;
    private BoundedCall boundedCall;
    private ActionGateway gateway;

    @Before
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        boundedCall = new BoundedCall();
        BotConfig config = BotConfig.DEFAULTS.toBuilder()
                .actionTimeout(Duration.ofMillis(200))
                .build();
        gateway = new ActionGateway(port, boundedCall, config);
    }

    @After
    public void tearDown() throws Exception {
        boundedCall.shutdown();
        mocks.close();
    }

    @Test
    public void testPerform_PortAccepts_Ok() throws Exception {
        Action click = Action.click(10, 20, "test");
        when(port.perform(click)).thenReturn(ActionResult.ok());

        assertTrue(gateway.perform(click).isOk());
        verify(port).perform(click);
    }

    @Test
    public void testPerform_PortFails_ResultPassedThrough() throws Exception {
        when(port.perform(any())).thenReturn(ActionResult.failed("no window"));

        ActionResult result = gateway.perform(Action.key("esc", "test"));

        assertFalse(result.isOk());
        assertEquals("no window", result.getMessage());
    }

    @Test
    public void testPerform_NullResult_Failed() throws Exception {
        when(port.perform(any())).thenReturn(null);

        ActionResult result = gateway.perform(Action.key("esc", "test"));

        assertEquals(ActionResult.Status.FAILED, result.getStatus());
    }

    @Test
    public void testPerform_PortThrows_Failed() throws Exception {
        when(port.perform(any())).thenThrow(new IllegalStateException("driver gone"));

        ActionResult result = gateway.perform(Action.key("esc", "test"));

        assertEquals(ActionResult.Status.FAILED, result.getStatus());
        assertTrue(result.getMessage().contains("driver gone"));
    }

    @Test
    public void testPerform_SlowPort_TimedOut() throws Exception {
        when(port.perform(any())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return ActionResult.ok();
        });

        long begin = System.nanoTime();
        ActionResult result = gateway.perform(Action.potion("1", "test"));
        long elapsedMs = (System.nanoTime() - begin) / 1_000_000;

        assertTrue(result.isTimedOut());
        assertTrue("Gateway should not wait for the port, took " + elapsedMs + "ms", elapsedMs < 2_000);
    }

    @Test
    public void testPerform_ExplicitTimeoutOverridesDefault() throws Exception {
        when(port.perform(any())).thenAnswer(inv -> {
            Thread.sleep(400);
            return ActionResult.ok();
        });

        assertTrue(gateway.perform(Action.key("esc", "slow"), Duration.ofSeconds(3)).isOk());
    }

    // ========================================================================
    // Action
    // ========================================================================

    @Test(expected = IllegalArgumentException.class)
    public void testKeySequence_ZeroRepeats_Throws() {
        Action.keySequence("esc", 0, "bad");
    }

    @Test
    public void testToString_DescribesAction() {
        assertEquals("click(5, 6) [escape]", Action.click(5, 6, "escape").toString());
        assertEquals("keys(esc x3) [cancel]", Action.keySequence("esc", 3, "cancel").toString());
    }
}
