package io.taskgateway.client.transport;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.taskgateway.client.config.GatewayConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * The JDK client's idle-connection pool is sized by JVM-wide system
 * properties; only the first value applies and later differing values are
 * reported.
 */
class PoolPropertiesTest {

    private static final String POOL_SIZE = "jdk.httpclient.connectionPoolSize";

    private final Logger logger = (Logger) LoggerFactory.getLogger(UpstreamClient.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    private static GatewayConfig withKeepAlive(int maxKeepAlive) {
        return GatewayConfig.builder()
                .baseUrl("http://127.0.0.1:1")
                .maxKeepAlive(maxKeepAlive)
                .build();
    }

    @Test
    void differingPoolSizeIsReportedAndIgnored() {
        String existing = System.getProperty(POOL_SIZE);
        if (existing == null) {
            new UpstreamClient(withKeepAlive(7)).close();
            existing = System.getProperty(POOL_SIZE);
        }
        int other = "3".equals(existing) ? 4 : 3;
        String expected = existing;

        new UpstreamClient(withKeepAlive(other)).close();

        assertThat(System.getProperty(POOL_SIZE)).isEqualTo(existing);
        assertThat(appender.list)
                .filteredOn(e -> e.getLevel() == Level.INFO)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message)
                        .contains(POOL_SIZE)
                        .contains("already " + expected)
                        .contains("configured value " + other + " is ignored"));
    }

    @Test
    void matchingPoolSizeIsNotReported() {
        String existing = System.getProperty(POOL_SIZE);
        if (existing == null) {
            new UpstreamClient(withKeepAlive(7)).close();
            existing = System.getProperty(POOL_SIZE);
        }

        new UpstreamClient(withKeepAlive(Integer.parseInt(existing))).close();

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .noneMatch(message -> message.contains(POOL_SIZE));
    }
}
