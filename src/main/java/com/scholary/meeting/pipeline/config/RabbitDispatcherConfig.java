package com.scholary.meeting.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.pipeline.dispatch.RabbitTaskDispatcher;
import com.scholary.meeting.pipeline.dispatch.RabbitTopology;
import com.scholary.meeting.pipeline.dispatch.StageTaskListener;
import com.scholary.meeting.pipeline.dispatch.TaskProcessor;
import com.scholary.meeting.pipeline.retry.BackoffPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ dispatcher: durable queues, TTL-based delayed retries and a dead-letter queue.
 *
 * <p>Consumers take one message at a time (prefetch 1) and acknowledge only after the stage
 * returned, so a worker crash hands the message to another worker.
 */
@Configuration
@ConditionalOnProperty(name = "pipeline.dispatcher.type", havingValue = "rabbit")
public class RabbitDispatcherConfig {

  @Bean
  public RabbitTopology rabbitTopology(PipelineProperties properties, BackoffPolicy backoffPolicy) {
    PipelineProperties.Rabbit rabbit = properties.rabbit();
    return new RabbitTopology(
        rabbit.exchange(),
        rabbit.workQueue(),
        rabbit.retryQueuePrefix(),
        rabbit.deadLetterQueue(),
        backoffPolicy);
  }

  @Bean
  public Declarables pipelineDeclarables(RabbitTopology topology) {
    DirectExchange exchange = ExchangeBuilder.directExchange(topology.exchange()).durable(true).build();

    Queue workQueue =
        QueueBuilder.durable(topology.workQueue())
            .deadLetterExchange(topology.exchange())
            .deadLetterRoutingKey(RabbitTopology.DEAD_LETTER_ROUTING_KEY)
            .build();
    Queue deadLetterQueue = QueueBuilder.durable(topology.deadLetterQueue()).build();

    List<Declarable> declarables = new ArrayList<>();
    declarables.add(exchange);
    declarables.add(workQueue);
    declarables.add(deadLetterQueue);
    declarables.add(BindingBuilder.bind(workQueue).to(exchange).with(RabbitTopology.WORK_ROUTING_KEY));
    declarables.add(
        BindingBuilder.bind(deadLetterQueue).to(exchange).with(RabbitTopology.DEAD_LETTER_ROUTING_KEY));

    for (Duration delay : topology.retryDelays()) {
      Queue retryQueue =
          QueueBuilder.durable(topology.retryQueue(delay))
              .ttl((int) delay.toMillis())
              .deadLetterExchange(topology.exchange())
              .deadLetterRoutingKey(RabbitTopology.WORK_ROUTING_KEY)
              .build();
      Binding binding =
          BindingBuilder.bind(retryQueue).to(exchange).with(topology.retryRoutingKey(delay));
      declarables.add(retryQueue);
      declarables.add(binding);
    }
    return new Declarables(declarables);
  }

  @Bean
  public MessageConverter taskMessageConverter(ObjectMapper objectMapper) {
    return new Jackson2JsonMessageConverter(objectMapper);
  }

  @Bean(name = "stageListenerContainerFactory")
  public SimpleRabbitListenerContainerFactory stageListenerContainerFactory(
      SimpleRabbitListenerContainerFactoryConfigurer configurer,
      ConnectionFactory connectionFactory,
      MessageConverter taskMessageConverter,
      PipelineProperties properties) {
    SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
    configurer.configure(factory, connectionFactory);
    factory.setMessageConverter(taskMessageConverter);
    factory.setPrefetchCount(1);
    factory.setConcurrentConsumers(properties.worker().threads());
    factory.setMaxConcurrentConsumers(properties.worker().threads());
    factory.setAcknowledgeMode(AcknowledgeMode.AUTO);
    factory.setDefaultRequeueRejected(true);
    return factory;
  }

  @Bean
  public RabbitTaskDispatcher rabbitTaskDispatcher(
      RabbitTemplate rabbitTemplate, RabbitTopology topology) {
    return new RabbitTaskDispatcher(rabbitTemplate, topology);
  }

  @Bean
  public StageTaskListener stageTaskListener(
      TaskProcessor taskProcessor, RabbitTaskDispatcher rabbitTaskDispatcher) {
    return new StageTaskListener(taskProcessor, rabbitTaskDispatcher);
  }
}
