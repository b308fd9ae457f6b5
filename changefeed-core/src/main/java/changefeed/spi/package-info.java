/**
 * Service Provider Interfaces (SPI) for plugging the change-feed engine into its environment.
 *
 * <p>Integrators implement the remote catalog client, the notification sink and the refresh
 * queue; the {@code changefeed-jdbc} module supplies the {@link changefeed.spi.ChangeStore}.
 *
 * @see changefeed.spi.FeedClient
 * @see changefeed.spi.ChangeStore
 * @see changefeed.spi.AnnouncementSink
 * @see changefeed.spi.RefreshQueue
 * @see changefeed.spi.MetricsExporter
 */
package changefeed.spi;
