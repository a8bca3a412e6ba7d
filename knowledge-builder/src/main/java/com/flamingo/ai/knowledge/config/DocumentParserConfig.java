package com.flamingo.ai.knowledge.config;

import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.detect.Detector;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.Parser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Provides the Apache Tika components used to read office documents. */
@Configuration
public class DocumentParserConfig {

  @Bean
  public Parser tikaParser() {
    return new AutoDetectParser();
  }

  @Bean
  public Detector tikaDetector() {
    return new DefaultDetector();
  }
}
