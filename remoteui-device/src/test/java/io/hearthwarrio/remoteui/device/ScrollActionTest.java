package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.ActionArgumentException;
import io.hearthwarrio.remoteui.core.Criteria;
import io.hearthwarrio.remoteui.testkit.RecordingAutomationService;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ScrollActionTest {

    private final RecordingAutomationService service = new RecordingAutomationService();
    private final RemoteUiDevice device = new RemoteUiDevice(service);
    private final UiObject list = device.ui(Criteria.res("list"));

    @Test
    void scrollByPercent() {
        service.respond("scroll", true);

        assertTrue(list.scroll().down().by(50));

        assertEquals("scroll", service.onlyCall().getMethod());
        assertEquals(Arrays.asList(Map.of("res", "list"), "DOWN", 50, null, null, null),
                service.onlyCall().getParams());
    }

    @Test
    void scrollByPercentWithSpeedAndMargin() {
        list.scroll().withMarginPercent(10).up().by(30, 1200);

        assertEquals(Arrays.asList(Map.of("res", "list"), "UP", 30, 1200, null, 10), service.onlyCall().getParams());
    }

    @Test
    void noArgumentsMeansScrollToEnd() {
        service.respond("scrollUntilFinished", true);

        assertTrue(list.scroll().down().toEnd());
        assertTrue(list.scroll().down().perform(null, null, null, null));

        assertEquals(List.of("scrollUntilFinished", "scrollUntilFinished"), service.methods());
        assertEquals(Arrays.asList(Map.of("res", "list"), "DOWN", null, null), service.lastCall().getParams());
    }

    @Test
    void scrollUntilCriteriaVisible() {
        service.respond("scrollUntil", true);

        assertTrue(list.scroll().down().until(Criteria.res("x")));

        assertEquals("scrollUntil", service.onlyCall().getMethod());
        assertEquals(Arrays.asList(Map.of("res", "list"), Map.of("res", "x"), "DOWN", null, null),
                service.onlyCall().getParams());
    }

    @Test
    void scrollUntilOtherHandleVisible() {
        UiObject about = device.ui(Criteria.text("About")).child(Criteria.res("summary"));

        list.scroll().withMargin(20).right().until(about);

        assertEquals(
                Arrays.asList(Map.of("res", "list"), Map.of("text", "About", "child", Map.of("res", "summary")),
                        "RIGHT", 20, null),
                service.onlyCall().getParams()
        );
    }

    @Test
    void percentWithTargetIsRejected() {
        UiObject target = device.ui(Criteria.text("X"));

        ActionArgumentException ex = assertThrows(
                ActionArgumentException.class,
                () -> list.scroll().down().perform(50, null, target, null)
        );

        assertEquals("scroll.down", ex.getOperation());
        assertEquals(0, service.callCount());
    }

    @Test
    void otherMixedShapesAreRejected() {
        UiObject target = device.ui(Criteria.text("X"));

        assertThrows(ActionArgumentException.class,
                () -> list.scroll().down().perform(50, null, null, Criteria.text("Y")));
        assertThrows(ActionArgumentException.class,
                () -> list.scroll().down().perform(null, 500, null, null));
        assertThrows(ActionArgumentException.class,
                () -> list.scroll().down().perform(null, 500, null, Criteria.text("Y")));
        assertThrows(ActionArgumentException.class,
                () -> list.scroll().down().perform(null, null, target, Criteria.text("Y")));
        assertEquals(0, service.callCount());
    }

    @Test
    void mixedMarginsAreRejected() {
        assertThrows(ActionArgumentException.class, () -> list.scroll().margins(1, 1));
    }

    @Test
    void scrollThenClickClicksTheMatchedElement() {
        service.respond("scrollUntil", true).respond("clickObj", true);

        assertTrue(list.scroll().down().click(Criteria.text("Battery")));

        assertEquals(List.of("scrollUntil", "clickObj"), service.methods());
        assertEquals(Arrays.asList(Map.of("text", "Battery"), null), service.lastCall().getParams());
    }

    @Test
    void scrollThenClickStopsWhenNotFound() {
        service.respond("scrollUntil", false);

        assertFalse(list.scroll().down().click(Criteria.text("Battery")));

        assertEquals(List.of("scrollUntil"), service.methods());
    }

    @Test
    void scrollThenClickNeedsCriteria() {
        ActionArgumentException ex = assertThrows(
                ActionArgumentException.class,
                () -> list.scroll().up().click(Criteria.any())
        );

        assertEquals("scroll.up.click", ex.getOperation());
        assertThrows(ActionArgumentException.class, () -> list.scroll().up().click(null));
        assertEquals(0, service.callCount());
    }
}
