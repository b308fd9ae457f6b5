package changefeed.spring.boot;

import changefeed.ChangeFeed;
import changefeed.announce.BurstWindow;
import changefeed.announce.Links;
import changefeed.jdbc.DataSourceConnectionProvider;
import changefeed.jdbc.store.AbstractJdbcChangeStore;
import changefeed.jdbc.store.JdbcChangeStores;
import changefeed.process.ImportantItems;
import changefeed.spi.AnnouncementSink;
import changefeed.spi.ChangeStore;
import changefeed.spi.ChatNotifier;
import changefeed.spi.ConnectionProvider;
import changefeed.spi.FeedClient;
import changefeed.spi.LocalStateStore;
import changefeed.spi.MetricsExporter;
import changefeed.spi.ProductInfoListener;
import changefeed.spi.RefreshQueue;
import changefeed.spi.TokenCache;
import changefeed.tracker.FileLocalStateStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Auto-configuration for the change feed engine.
 *
 * <p>Wires a {@link ChangeFeed} from a {@link DataSource} and the application's
 * {@link FeedClient}, {@link AnnouncementSink} and {@link RefreshQueue} beans. The
 * {@link ChatNotifier}, {@link ProductInfoListener}, {@link TokenCache} and
 * {@link MetricsExporter} beans are picked up when present.
 *
 * @see ChangeFeedProperties
 * @see ChangeFeedMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ChangeFeed.class)
@ConditionalOnBean({DataSource.class, FeedClient.class, AnnouncementSink.class, RefreshQueue.class})
@EnableConfigurationProperties(ChangeFeedProperties.class)
public class ChangeFeedAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ChangeStore.class)
  public AbstractJdbcChangeStore changeStore(DataSource dataSource) {
    return JdbcChangeStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(LocalStateStore.class)
  public FileLocalStateStore localStateStore(ChangeFeedProperties props) {
    return new FileLocalStateStore(Path.of(props.getStateFile()));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ChangeFeed changeFeed(ChangeFeedProperties props,
      ConnectionProvider connectionProvider,
      ChangeStore changeStore,
      LocalStateStore localStateStore,
      FeedClient feedClient,
      AnnouncementSink announcementSink,
      RefreshQueue refreshQueue,
      ObjectProvider<ChatNotifier> chatNotifierProvider,
      ObjectProvider<ProductInfoListener> productInfoListenerProvider,
      ObjectProvider<TokenCache> tokenCacheProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = ChangeFeed.builder()
        .connectionProvider(connectionProvider)
        .changeStore(changeStore)
        .localStateStore(localStateStore)
        .feedClient(feedClient)
        .announcementSink(announcementSink)
        .refreshQueue(refreshQueue)
        .fullRunMode(props.getFullRun())
        .storeQueryEnabled(props.isStoreQueryEnabled())
        .intervalMs(props.getPoller().getIntervalMs())
        .requestTimeoutMs(props.getPoller().getRequestTimeoutMs())
        .workerCount(props.getDispatcher().getWorkerCount())
        .drainTimeoutMs(props.getDispatcher().getDrainTimeoutMs())
        .statusIntervalMs(props.getStatusIntervalMs())
        .links(new Links(props.getLinks().getBaseUrl()))
        .burstWindow(new BurstWindow(Clock.systemUTC(),
            props.getBurst().getThreshold(), props.getBurst().getWindow()))
        .importantItems(new ImportantItems(
            props.getImportant().getApps(), props.getImportant().getPackages()))
        .chatNotifier(chatNotifierProvider.getIfAvailable(() -> ChatNotifier.NONE))
        .productInfoListener(productInfoListenerProvider.getIfAvailable(() -> ProductInfoListener.NONE));

    TokenCache tokenCache = tokenCacheProvider.getIfAvailable();
    if (tokenCache != null) {
      builder.tokenCache(tokenCache);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }

    ChangeFeed feed = builder.build();
    if (props.isAutoStart()) {
      feed.start();
    }
    return feed;
  }
}
