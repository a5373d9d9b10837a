package relay.spring.boot;

import relay.account.AccountManager;
import relay.broker.ConnectionBroker;
import relay.directory.DirectoryBrokers;
import relay.directory.DirectorySettings;
import relay.directory.Search;
import relay.directory.SearchResult;
import relay.jdbc.DataSourceConnectionProvider;
import relay.jdbc.store.AbstractJdbcMessageStore;
import relay.jdbc.store.JdbcMessageStores;
import relay.spi.AccountClientFactory;
import relay.spi.ConnectionProvider;
import relay.spi.MessageStore;
import relay.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.List;

/**
 * Auto-configuration for the relay.
 *
 * <p>Wires a started {@link AccountManager} from a {@link DataSource} and
 * {@link RelayProperties}. Client factories are discovered through
 * {@link java.util.ServiceLoader} and from {@link AccountClientFactory} beans. A directory
 * broker is added when {@code relay.directory.url} is set.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, SqlInitializationAutoConfiguration.class})
@ConditionalOnClass(AccountManager.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MessageStore.class)
  public AbstractJdbcMessageStore messageStore(DataSource dataSource) {
    return JdbcMessageStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @DependsOnDatabaseInitialization
  public AccountManager accountManager(RelayProperties props,
      ConnectionProvider connectionProvider,
      MessageStore messageStore,
      ObjectProvider<AccountClientFactory> factoryProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = AccountManager.builder()
        .connectionProvider(connectionProvider)
        .messageStore(messageStore)
        .refreshInterval(props.getRefreshInterval())
        .pollDelay(props.getPollDelay())
        .handoffTimeout(props.getHandoffTimeout())
        .batchSize(props.getBatchSize())
        .defaultNick(props.getDefaultNick());
    if (props.getAccounts() != null) {
      builder.accounts(props.getAccounts());
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    factoryProvider.orderedStream().forEach(builder::clientFactory);
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(name = "directoryBroker")
  @ConditionalOnProperty(prefix = "relay.directory", name = "url")
  public ConnectionBroker<Search, List<SearchResult>> directoryBroker(RelayProperties props) {
    RelayProperties.Directory dir = props.getDirectory();
    DirectorySettings settings = new DirectorySettings(
        dir.getUrl(), dir.getBaseDn(), dir.getBindDn(), dir.getBindPassword());
    return DirectoryBrokers.builder(settings)
        .requestTimeout(dir.getRequestTimeout())
        .redialDelay(dir.getRedialDelay())
        .pingInterval(dir.getPingInterval())
        .build();
  }
}
