package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.ActionArgumentException;
import io.hearthwarrio.remoteui.core.Criteria;
import io.hearthwarrio.remoteui.testkit.RecordedCall;
import io.hearthwarrio.remoteui.testkit.RecordingAutomationService;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ClickActionTest {

    private final RecordingAutomationService service = new RecordingAutomationService()
            .respond("clickObj", true)
            .respond("clickObjPoint", true)
            .respond("click", true);
    private final List<String> deprecations = new ArrayList<>();
    private final RemoteUiDevice device = new RemoteUiDevice(service, new RpcCallLogger() {
        @Override
        public void logCall(String method, List<Object> params, Object result) {
        }

        @Override
        public void logDeprecation(String message) {
            deprecations.add(message);
        }
    });
    private final UiObject button = device.ui(Criteria.text("OK"));

    @Test
    void plainClick() {
        assertTrue(button.click().perform());

        RecordedCall call = service.onlyCall();
        assertEquals("clickObj", call.getMethod());
        assertEquals(Arrays.asList(Map.of("text", "OK"), null), call.getParams());
    }

    @Test
    void clickWithHoldDuration() {
        assertTrue(button.click().perform(Duration.ofMillis(1500)));

        assertEquals(Arrays.asList(Map.of("text", "OK"), 1500L), service.onlyCall().getParams());
    }

    @Test
    void clickAtPoint() {
        assertTrue(button.click().perform(null, 5, 10));

        RecordedCall call = service.onlyCall();
        assertEquals("clickObjPoint", call.getMethod());
        assertEquals(Arrays.asList(Map.of("text", "OK"), 5, 10, null), call.getParams());
    }

    @Test
    void clickAtPointWithDuration() {
        assertTrue(button.click().at(1, 2, Duration.ofSeconds(1)));

        assertEquals(Arrays.asList(Map.of("text", "OK"), 1, 2, 1000L), service.onlyCall().getParams());
    }

    @Test
    void singleCoordinateIsRejectedBeforeAnyCall() {
        ActionArgumentException ex = assertThrows(
                ActionArgumentException.class,
                () -> button.click().perform(null, 5, null)
        );

        assertEquals("click", ex.getOperation());
        assertTrue(ex.getMessage().contains("x=5"), ex.getMessage());
        assertThrows(ActionArgumentException.class, () -> button.click().perform(null, null, 10));
        assertEquals(0, service.callCount());
    }

    @Test
    @SuppressWarnings("deprecation")
    void deprecatedTimeoutActsAsDurationAndWarns() {
        assertTrue(button.click().perform(null, Duration.ofMillis(700), null, null));

        assertEquals(Arrays.asList(Map.of("text", "OK"), 700L), service.onlyCall().getParams());
        assertEquals(1, deprecations.size());
        assertTrue(deprecations.get(0).contains("'timeout'"));
    }

    @Test
    @SuppressWarnings("deprecation")
    void deprecatedTimeoutWinsOverDuration() {
        button.click().perform(Duration.ofMillis(100), Duration.ofMillis(900), 3, 4);

        assertEquals(Arrays.asList(Map.of("text", "OK"), 3, 4, 900L), service.onlyCall().getParams());
        assertEquals(1, deprecations.size());
    }

    @Test
    @SuppressWarnings("deprecation")
    void deprecatedFormWithoutTimeoutDoesNotWarn() {
        button.click().perform(Duration.ofMillis(100), null, null, null);

        assertTrue(deprecations.isEmpty());
    }

    @Test
    void bottomRightResolvesBoundsThenClicksCorner() {
        service.respond("getVisibleBounds", Map.of("left", 10, "top", 20, "right", 110, "bottom", 220));

        assertTrue(button.click().bottomRight());

        assertEquals(List.of("getVisibleBounds", "click"), service.methods());
        assertEquals(List.of(110, 220), service.lastCall().getParams());
    }

    @Test
    void topLeftResolvesBoundsThenClicksCorner() {
        service.respond("getVisibleBounds", Map.of("left", 10, "top", 20, "right", 110, "bottom", 220));

        assertTrue(button.click().topLeft());

        assertEquals(List.of(10, 20), service.lastCall().getParams());
    }

    @Test
    void cornerClickOnVanishedElementReturnsFalse() {
        assertFalse(button.click().bottomRight());
        assertFalse(button.click().topLeft());

        assertEquals(List.of("getVisibleBounds", "getVisibleBounds"), service.methods());
    }

    @Test
    void clickAndWaitForWindowTransition() {
        service.respond("clickObjAndWait", true);

        assertTrue(button.click().andWait(Duration.ofSeconds(3)));

        assertEquals(Arrays.asList(Map.of("text", "OK"), 3000L), service.onlyCall().getParams());
    }

    @Test
    void clickAndWaitDefaultsToUiWaitTime() {
        device.withUiWaitTime(Duration.ofSeconds(4));

        assertFalse(button.click().andWait());

        assertEquals(4000L, service.onlyCall().param(1));
    }

    @Test
    void clickAndWaitRejectsTimeoutAtRpcCeiling() {
        ActionArgumentException ex = assertThrows(
                ActionArgumentException.class,
                () -> button.click().andWait(device.getRpcTimeout())
        );

        assertEquals("click.andWait", ex.getOperation());
        assertEquals(0, service.callCount());
    }
}
