package io.hearthwarrio.remoteui.allure;

import io.hearthwarrio.remoteui.core.Criteria;
import io.hearthwarrio.remoteui.device.RemoteUiDevice;
import io.hearthwarrio.remoteui.device.RpcCallLogger;
import io.hearthwarrio.remoteui.device.RpcLogDetail;
import io.hearthwarrio.remoteui.device.UiObject;
import io.hearthwarrio.remoteui.testkit.RecordingAutomationService;
import io.qameta.allure.Allure;
import io.qameta.allure.AllureLifecycle;
import io.qameta.allure.AllureResultsWriter;
import io.qameta.allure.model.Attachment;
import io.qameta.allure.model.StepResult;
import io.qameta.allure.model.TestResult;
import io.qameta.allure.model.TestResultContainer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs remote calls inside an Allure test case and inspects the written result.
 */
public class AllureStepRecordingTest {

    private final InMemoryResultsWriter writer = new InMemoryResultsWriter();
    private final AllureLifecycle lifecycle = new AllureLifecycle(writer);
    private final String testUuid = UUID.randomUUID().toString();

    private final RecordingAutomationService service = new RecordingAutomationService()
            .respond("exists", true)
            .respond("clickObj", false)
            .respond("getText", "Submit");

    private AllureLifecycle previous;

    @BeforeEach
    void startTestCase() {
        previous = Allure.getLifecycle();
        Allure.setLifecycle(lifecycle);

        TestResult result = new TestResult();
        result.setUuid(testUuid);
        result.setName("remote calls");
        lifecycle.scheduleTestCase(result);
        lifecycle.startTestCase(testUuid);
    }

    @AfterEach
    void restoreLifecycle() {
        Allure.setLifecycle(previous);
    }

    @Test
    void failedCallsOnlyRecordsFalseAndNullResults() {
        UiObject button = deviceWith(new AllureRpcCallLogger(RpcLogDetail.SELECTOR, true))
                .ui(Criteria.res("android:id/button1"));

        button.exists();
        button.click().perform();
        button.text();
        button.isChecked();

        List<StepResult> steps = finishAndGetSteps();
        assertEquals(2, steps.size());
        assertTrue(steps.get(0).getName().startsWith("RemoteUi: clickObj"), steps.get(0).getName());
        assertTrue(steps.get(0).getName().endsWith("false"), steps.get(0).getName());
        assertTrue(steps.get(1).getName().startsWith("RemoteUi: isChecked"), steps.get(1).getName());
        assertTrue(steps.get(1).getName().endsWith("null"), steps.get(1).getName());
    }

    @Test
    void everyCallBecomesAStepWithRemoteCallAttachment() {
        UiObject button = deviceWith(new AllureRpcCallLogger(RpcLogDetail.SELECTOR, false))
                .ui(Criteria.res("android:id/button1"));

        button.exists();
        button.click().perform();
        button.text();

        List<StepResult> steps = finishAndGetSteps();
        assertEquals(3, steps.size());
        for (StepResult step : steps) {
            assertEquals(1, step.getAttachments().size(), step.getName());
            Attachment attachment = step.getAttachments().get(0);
            assertEquals("Remote call", attachment.getName());
            assertEquals("text/plain", attachment.getType());

            String content = writer.attachmentText(attachment.getSource());
            assertTrue(content.contains("selector: "), content);
            assertTrue(content.contains("android:id/button1"), content);
        }
        assertTrue(writer.attachmentText(steps.get(2).getAttachments().get(0).getSource())
                .contains("result: Submit"));
    }

    @Test
    void noneDetailAttachesMethodAndResultOnly() {
        deviceWith(RemoteUiAllureLoggers.remoteCalls(RpcLogDetail.NONE, false))
                .ui(Criteria.text("OK"))
                .exists();

        StepResult step = finishAndGetSteps().get(0);
        String content = writer.attachmentText(step.getAttachments().get(0).getSource());
        assertEquals("method: exists\nresult: true\n", content);
    }

    @Test
    @SuppressWarnings("deprecation")
    void deprecationNoticeBecomesItsOwnStep() {
        deviceWith(RemoteUiAllureLoggers.remoteCalls())
                .ui(Criteria.text("OK"))
                .click()
                .perform(null, Duration.ofMillis(300), null, null);

        List<StepResult> steps = finishAndGetSteps();
        assertEquals(2, steps.size());
        assertTrue(steps.get(0).getName().startsWith("RemoteUi deprecation: "), steps.get(0).getName());
        assertTrue(steps.get(0).getAttachments().isEmpty());
        assertTrue(steps.get(1).getName().startsWith("RemoteUi: clickObj"), steps.get(1).getName());
        assertEquals(300L, service.onlyCall().param(1));
    }

    private RemoteUiDevice deviceWith(RpcCallLogger logger) {
        return new RemoteUiDevice(service).withLogger(logger);
    }

    private List<StepResult> finishAndGetSteps() {
        lifecycle.stopTestCase(testUuid);
        lifecycle.writeTestCase(testUuid);

        assertEquals(1, writer.results.size());
        return writer.results.get(0).getSteps();
    }

    // -----------

    private static final class InMemoryResultsWriter implements AllureResultsWriter {

        private final List<TestResult> results = new ArrayList<>();
        private final Map<String, byte[]> attachments = new HashMap<>();

        @Override
        public void write(TestResult testResult) {
            results.add(testResult);
        }

        @Override
        public void write(TestResultContainer testResultContainer) {
            // containers are not inspected
        }

        @Override
        public void write(String source, InputStream attachment) {
            try {
                attachments.put(source, attachment.readAllBytes());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        String attachmentText(String source) {
            byte[] bytes = attachments.get(source);
            assertNotNull(bytes, "no attachment written for " + source);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }
}
