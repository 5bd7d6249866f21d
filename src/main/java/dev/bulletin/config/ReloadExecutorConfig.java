package dev.bulletin.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Single background thread that runs knowledge-base reloads, so at most one reload executes at a
 * time and no request thread ever waits on one.
 */
@Configuration
public class ReloadExecutorConfig {

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService reloadExecutor() {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("kb-reload-");
    threadFactory.setDaemon(true);
    return Executors.newSingleThreadExecutor(threadFactory);
  }
}
