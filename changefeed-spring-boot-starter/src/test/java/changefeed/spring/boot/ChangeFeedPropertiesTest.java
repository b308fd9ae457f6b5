package changefeed.spring.boot;

import changefeed.resync.FullRunMode;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeFeedPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(ChangeFeedProperties.class);
            assertEquals(FullRunMode.NONE, props.getFullRun());
            assertTrue(props.isStoreQueryEnabled());
            assertTrue(props.isAutoStart());
            assertEquals("last-changenumber.txt", props.getStateFile());
            assertEquals(10000, props.getStatusIntervalMs());
            assertEquals(10000, props.getPoller().getIntervalMs());
            assertEquals(30000, props.getPoller().getRequestTimeoutMs());
            assertEquals(4, props.getDispatcher().getWorkerCount());
            assertEquals(5000, props.getDispatcher().getDrainTimeoutMs());
            assertTrue(props.getImportant().getApps().isEmpty());
            assertTrue(props.getImportant().getPackages().isEmpty());
            assertEquals("https://steamdb.info", props.getLinks().getBaseUrl());
            assertEquals(50, props.getBurst().getThreshold());
            assertEquals(Duration.ofMinutes(5), props.getBurst().getWindow());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("changefeed", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "changefeed.full-run=TOKENS_ONLY",
                "changefeed.store-query-enabled=false",
                "changefeed.auto-start=false",
                "changefeed.state-file=/var/lib/changefeed/state",
                "changefeed.status-interval-ms=2000",
                "changefeed.poller.interval-ms=1000",
                "changefeed.poller.request-timeout-ms=15000",
                "changefeed.dispatcher.worker-count=8",
                "changefeed.dispatcher.drain-timeout-ms=10000",
                "changefeed.important.apps=440,570",
                "changefeed.important.packages=0",
                "changefeed.links.base-url=https://example.org",
                "changefeed.burst.threshold=20",
                "changefeed.burst.window=PT2M",
                "changefeed.metrics.enabled=false",
                "changefeed.metrics.name-prefix=steam.changefeed"
        ).run(ctx -> {
            var props = ctx.getBean(ChangeFeedProperties.class);
            assertEquals(FullRunMode.TOKENS_ONLY, props.getFullRun());
            assertFalse(props.isStoreQueryEnabled());
            assertFalse(props.isAutoStart());
            assertEquals("/var/lib/changefeed/state", props.getStateFile());
            assertEquals(2000, props.getStatusIntervalMs());
            assertEquals(1000, props.getPoller().getIntervalMs());
            assertEquals(15000, props.getPoller().getRequestTimeoutMs());
            assertEquals(8, props.getDispatcher().getWorkerCount());
            assertEquals(10000, props.getDispatcher().getDrainTimeoutMs());
            assertEquals(List.of(440, 570), props.getImportant().getApps());
            assertEquals(List.of(0), props.getImportant().getPackages());
            assertEquals("https://example.org", props.getLinks().getBaseUrl());
            assertEquals(20, props.getBurst().getThreshold());
            assertEquals(Duration.ofMinutes(2), props.getBurst().getWindow());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("steam.changefeed", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(ChangeFeedProperties.class)
    static class PropsConfig {
    }
}
