package com.ivamare.cqrs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.cqrs.command.CommandHandler;
import com.ivamare.cqrs.event.CompositeDomainEventPublisher;
import com.ivamare.cqrs.event.DispatchingDomainEventPublisher;
import com.ivamare.cqrs.event.DomainEventHandler;
import com.ivamare.cqrs.event.DomainEventPublisher;
import com.ivamare.cqrs.event.EventDispatcher;
import com.ivamare.cqrs.event.impl.DefaultEventDispatcher;
import com.ivamare.cqrs.handler.CommandHandlerRegistry;
import com.ivamare.cqrs.handler.QueryHandlerRegistry;
import com.ivamare.cqrs.handler.impl.DefaultCommandHandlerRegistry;
import com.ivamare.cqrs.handler.impl.DefaultQueryHandlerRegistry;
import com.ivamare.cqrs.mediator.Mediator;
import com.ivamare.cqrs.mediator.impl.DefaultMediator;
import com.ivamare.cqrs.outbox.MessageOutboxRepository;
import com.ivamare.cqrs.outbox.OutboxEventSerializer;
import com.ivamare.cqrs.outbox.OutboxPublisher;
import com.ivamare.cqrs.outbox.impl.InMemoryMessageOutboxRepository;
import com.ivamare.cqrs.outbox.impl.JacksonOutboxEventSerializer;
import com.ivamare.cqrs.outbox.impl.JdbcMessageOutboxRepository;
import com.ivamare.cqrs.outbox.worker.OutboxPublishingWorker;
import com.ivamare.cqrs.pipeline.CommandInterceptor;
import com.ivamare.cqrs.pipeline.OutboxInterceptor;
import com.ivamare.cqrs.pipeline.QueryInterceptor;
import com.ivamare.cqrs.pipeline.TransactionInterceptor;
import com.ivamare.cqrs.query.QueryHandler;
import com.ivamare.cqrs.transaction.NoopTransactionManager;
import com.ivamare.cqrs.transaction.SpringTransactionManager;
import com.ivamare.cqrs.transaction.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for the CQRS mediator.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Command and query handler registries, filled from handler beans</li>
 *   <li>Event dispatcher, filled from domain event handler beans</li>
 *   <li>Transaction manager (Spring-backed when a PlatformTransactionManager exists)</li>
 *   <li>Outbox store, serializer, publisher and publishing worker</li>
 *   <li>Transaction and outbox interceptors</li>
 *   <li>Mediator</li>
 * </ul>
 *
 * <p>Interceptor beans are applied in {@code @Order}; the transaction interceptor is
 * ordered at {@value #TRANSACTION_INTERCEPTOR_ORDER} and the outbox interceptor at
 * {@value #OUTBOX_INTERCEPTOR_ORDER}.
 *
 * <p>To disable auto-configuration:
 * <pre>
 * cqrs.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class,
    TransactionAutoConfiguration.class
})
@ConditionalOnProperty(prefix = "cqrs", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CqrsProperties.class)
@Import(OutboxWorkerAutoStartConfiguration.class)
public class CqrsAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CqrsAutoConfiguration.class);

    public static final int TRANSACTION_INTERCEPTOR_ORDER = 100;
    public static final int OUTBOX_INTERCEPTOR_ORDER = 200;

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper cqrsObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- Handler Registries ---

    @Bean
    @ConditionalOnMissingBean
    public CommandHandlerRegistry commandHandlerRegistry(
            CqrsProperties properties,
            ObjectProvider<CommandHandler<?, ?>> handlers) {
        CommandHandlerRegistry registry = new DefaultCommandHandlerRegistry(properties.isFailOnDuplicateHandler());
        handlers.orderedStream().forEach(registry::registerBean);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryHandlerRegistry queryHandlerRegistry(
            CqrsProperties properties,
            ObjectProvider<QueryHandler<?, ?>> handlers) {
        QueryHandlerRegistry registry = new DefaultQueryHandlerRegistry(properties.isFailOnDuplicateHandler());
        handlers.orderedStream().forEach(registry::registerBean);
        return registry;
    }

    // --- Event Dispatcher ---

    @Bean
    @ConditionalOnMissingBean
    public EventDispatcher eventDispatcher(ObjectProvider<DomainEventHandler<?>> handlers) {
        EventDispatcher dispatcher = new DefaultEventDispatcher();
        handlers.orderedStream().forEach(dispatcher::registerBean);
        return dispatcher;
    }

    // --- Transactions ---

    @Bean
    @ConditionalOnMissingBean
    public TransactionManager cqrsTransactionManager(ObjectProvider<PlatformTransactionManager> platformTransactionManager) {
        PlatformTransactionManager ptm = platformTransactionManager.getIfUnique();
        if (ptm == null) {
            log.info("No unique PlatformTransactionManager found, commands run without a transaction");
            return NoopTransactionManager.INSTANCE;
        }
        return new SpringTransactionManager(ptm);
    }

    // --- Outbox ---

    @Bean
    @ConditionalOnMissingBean
    public OutboxEventSerializer outboxEventSerializer(ObjectMapper objectMapper) {
        return new JacksonOutboxEventSerializer(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cqrs.outbox", name = "store", havingValue = "memory", matchIfMissing = true)
    public MessageOutboxRepository inMemoryMessageOutboxRepository() {
        return new InMemoryMessageOutboxRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cqrs.outbox", name = "store", havingValue = "jdbc")
    public MessageOutboxRepository jdbcMessageOutboxRepository(
            JdbcTemplate jdbcTemplate,
            OutboxEventSerializer serializer,
            CqrsProperties properties) {
        return new JdbcMessageOutboxRepository(
            jdbcTemplate,
            serializer,
            properties.getOutbox().getTableName(),
            Clock.systemUTC()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public OutboxPublisher outboxPublisher(
            MessageOutboxRepository outboxRepository,
            ObjectProvider<DomainEventPublisher> eventPublisher,
            EventDispatcher eventDispatcher) {
        List<DomainEventPublisher> publishers = eventPublisher.orderedStream().toList();
        DomainEventPublisher target;
        if (publishers.isEmpty()) {
            target = new DispatchingDomainEventPublisher(eventDispatcher);
        } else if (publishers.size() == 1) {
            target = publishers.get(0);
        } else {
            log.info("Outbox publisher fans out to {} DomainEventPublisher beans", publishers.size());
            target = new CompositeDomainEventPublisher(publishers);
        }
        return new OutboxPublisher(outboxRepository, target);
    }

    @Bean
    @ConditionalOnMissingBean
    public OutboxPublishingWorker outboxPublishingWorker(OutboxPublisher outboxPublisher, CqrsProperties properties) {
        CqrsProperties.OutboxProperties outbox = properties.getOutbox();
        return new OutboxPublishingWorker(
            outboxPublisher,
            outbox.getBatchSize(),
            outbox.getPublisher().getPollIntervalMs(),
            outbox.getPublisher().getInitialDelayMs()
        );
    }

    // --- Interceptors ---

    @Bean
    @Order(TRANSACTION_INTERCEPTOR_ORDER)
    @ConditionalOnMissingBean
    public TransactionInterceptor transactionInterceptor(TransactionManager transactionManager) {
        return new TransactionInterceptor(transactionManager);
    }

    @Bean
    @Order(OUTBOX_INTERCEPTOR_ORDER)
    @ConditionalOnMissingBean
    public OutboxInterceptor outboxInterceptor(MessageOutboxRepository outboxRepository) {
        return new OutboxInterceptor(outboxRepository);
    }

    // --- Mediator ---

    @Bean
    @ConditionalOnMissingBean
    public Mediator mediator(
            CommandHandlerRegistry commandHandlerRegistry,
            QueryHandlerRegistry queryHandlerRegistry,
            ObjectProvider<CommandInterceptor> commandInterceptors,
            ObjectProvider<QueryInterceptor> queryInterceptors) {
        return new DefaultMediator(
            commandHandlerRegistry,
            commandInterceptors.orderedStream().toList(),
            queryHandlerRegistry,
            queryInterceptors.orderedStream().toList()
        );
    }
}
