package com.aiadvent.statements.config;

import com.aiadvent.statements.ast.CstParser;
import com.aiadvent.statements.ast.LanguageRegistry;
import com.aiadvent.statements.ast.TreeSitterParser;
import com.aiadvent.statements.service.StatementTreeService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnProperty(prefix = "statements.tree", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(StatementTreeProperties.class)
public class StatementTreeAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public LanguageRegistry languageRegistry() {
    return new LanguageRegistry();
  }

  @Bean
  @ConditionalOnMissingBean(CstParser.class)
  public TreeSitterParser treeSitterParser(
      LanguageRegistry languageRegistry, StatementTreeProperties properties) {
    return new TreeSitterParser(languageRegistry, properties);
  }

  @Bean
  @ConditionalOnMissingBean
  public StatementTreeService statementTreeService(
      StatementTreeProperties properties,
      CstParser parser,
      ObjectProvider<MeterRegistry> meterRegistry) {
    return new StatementTreeService(properties, parser, meterRegistry.getIfAvailable());
  }
}
