package com.ospicorp.weatherapi.config;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${weather.http.connect-timeout:5s}") Duration connectTimeout,
      @Value("${weather.http.read-timeout:10s}") Duration readTimeout) {
    return builder
        .setConnectTimeout(connectTimeout)
        .setReadTimeout(readTimeout)
        .build();
  }

  // Runs each inbound query so the caller can bound it with a deadline.
  // A saturated pool runs the query on the request thread instead of rejecting it.
  @Bean(name = "weatherQueryExecutor")
  public ThreadPoolTaskExecutor weatherQueryExecutor(@Value("${weather.query-pool-size:16}") int poolSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(poolSize * 4);
    executor.setRejectedExecutionHandler((task, pool) -> {
      if (pool.isShutdown()) {
        throw new RejectedExecutionException("Weather query executor is shut down");
      }
      task.run();
    });
    executor.setThreadNamePrefix("weather-query-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setTaskDecorator(task -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        if (context != null) {
          MDC.setContextMap(context);
        }
        try {
          task.run();
        } finally {
          MDC.clear();
        }
      };
    });
    return executor;
  }
}
