package io.caresync.spring.boot;

import io.caresync.CareScheduler;
import io.caresync.CareStores;
import io.caresync.jdbc.DataSourceConnectionProvider;
import io.caresync.jdbc.JdbcCareStores;
import io.caresync.jdbc.dialect.Dialects;
import io.caresync.jdbc.spi.Dialect;
import io.caresync.reminder.ReminderPlanner;
import io.caresync.retry.ExponentialBackoffRetryPolicy;
import io.caresync.schedule.ScheduleService;
import io.caresync.spi.AlertSink;
import io.caresync.spi.CalendarClientFactory;
import io.caresync.spi.ConnectionProvider;
import io.caresync.spi.MetricsExporter;
import io.caresync.spi.SlotSourceFactory;
import io.caresync.spi.SyncConflictListener;
import io.caresync.spi.WatcherMonitor;
import io.caresync.sync.ConflictResolver;
import io.caresync.sync.LastWriterWinsResolver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.ZoneId;

/**
 * Auto-configuration for the care scheduler.
 *
 * <p>Wires a {@link CareScheduler} from a {@link DataSource} and {@link CareSyncProperties}.
 * Calendar sync starts when a {@link CalendarClientFactory} bean exists; cancellation
 * watching when {@link SlotSourceFactory} and {@link AlertSink} beans exist.
 *
 * @see CareSyncProperties
 * @see CareSyncMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(CareScheduler.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(CareSyncProperties.class)
public class CareSyncAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Dialect careSyncDialect(DataSource dataSource) {
        return Dialects.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public CareStores careStores(DataSource dataSource, Dialect dialect, CareSyncProperties props) {
        if (props.isInitializeSchema()) {
            JdbcCareStores.createSchema(dataSource, dialect);
        }
        return JdbcCareStores.create(dialect);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider careSyncConnectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConflictResolver conflictResolver(CareSyncProperties props) {
        return new LastWriterWinsResolver(props.getSync().getConflictGranularity(), props.getSync().getTieBreaker());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public CareScheduler careScheduler(CareSyncProperties props,
                                       ConnectionProvider connectionProvider,
                                       CareStores stores,
                                       ConflictResolver conflictResolver,
                                       ObjectProvider<CalendarClientFactory> calendarClients,
                                       ObjectProvider<SlotSourceFactory> slotSources,
                                       ObjectProvider<AlertSink> alertSinks,
                                       ObjectProvider<WatcherMonitor> watcherMonitors,
                                       ObjectProvider<SyncConflictListener> conflictListeners,
                                       ObjectProvider<MetricsExporter> metricsProvider) {
        CareSyncProperties.Sync sync = props.getSync();
        CareSyncProperties.Watch watch = props.getWatch();

        var builder = CareScheduler.builder()
                .connectionProvider(connectionProvider)
                .stores(stores)
                .conflictResolver(conflictResolver)
                .watcherMonitor(watcherMonitors.getIfAvailable())
                .conflictListener(conflictListeners.getIfAvailable())
                .metrics(metricsProvider.getIfAvailable())
                .syncWorkerCount(sync.getWorkerCount())
                .syncIntervalMs(sync.getIntervalMs())
                .syncMaxAttempts(sync.getMaxAttempts())
                .syncCallTimeoutMs(sync.getCallTimeoutMs())
                .syncRetryPolicy(new ExponentialBackoffRetryPolicy(
                        sync.getRetry().getBaseDelayMs(), sync.getRetry().getMaxDelayMs()))
                .pollIntervalMs(watch.getPollIntervalMs())
                .dedupWindow(watch.getDedupWindow())
                .rateLimit(watch.getRateLimit())
                .rateLimitWindow(watch.getRateLimitWindow())
                .watcherRetryBudget(watch.getRetryBudget())
                .housekeepingIntervalMs(watch.getHousekeepingIntervalMs())
                .inactivityPeriod(watch.getInactivityPeriod())
                .watcherRetryPolicy(new ExponentialBackoffRetryPolicy(
                        watch.getRetry().getBaseDelayMs(), watch.getRetry().getMaxDelayMs()));
        if (props.getZone() != null && !props.getZone().isEmpty()) {
            builder.zone(ZoneId.of(props.getZone()));
        }
        if (sync.isEnabled()) {
            builder.calendarClientFactory(calendarClients.getIfAvailable());
        }
        SlotSourceFactory slotSourceFactory = slotSources.getIfAvailable();
        AlertSink alertSink = alertSinks.getIfAvailable();
        if (watch.isEnabled() && slotSourceFactory != null && alertSink != null) {
            builder.slotSourceFactory(slotSourceFactory).alertSink(alertSink);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleService scheduleService(CareScheduler careScheduler) {
        return careScheduler.schedules();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReminderPlanner reminderPlanner(CareScheduler careScheduler) {
        return careScheduler.reminders();
    }
}
