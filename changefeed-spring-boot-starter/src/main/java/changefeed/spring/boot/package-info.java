/**
 * Spring Boot auto-configuration for the change feed engine.
 *
 * <p>Add this module to the classpath and provide a {@code DataSource}, a
 * {@link changefeed.spi.FeedClient}, an {@link changefeed.spi.AnnouncementSink} and a
 * {@link changefeed.spi.RefreshQueue}; {@link changefeed.spring.boot.ChangeFeedAutoConfiguration}
 * builds and starts the {@link changefeed.ChangeFeed}. Settings bind from the {@code changefeed.*}
 * properties described by {@link changefeed.spring.boot.ChangeFeedProperties}.
 */
package changefeed.spring.boot;
