package com.flamingo.ai.knowledge.config;

import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import picocli.CommandLine;

/**
 * Lets picocli obtain command objects from the Spring context so commands can have their services
 * injected. Classes that are not beans (help mixins, converters) fall back to picocli's default
 * factory.
 */
@Configuration
public class CommandLineConfig {

  @Bean
  public CommandLine.IFactory commandFactory(ApplicationContext applicationContext) {
    return new CommandLine.IFactory() {
      @Override
      public <K> K create(Class<K> cls) throws Exception {
        try {
          return applicationContext.getBean(cls);
        } catch (NoSuchBeanDefinitionException e) {
          return CommandLine.defaultFactory().create(cls);
        }
      }
    };
  }
}
