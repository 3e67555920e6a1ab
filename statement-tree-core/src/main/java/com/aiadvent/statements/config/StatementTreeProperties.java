package com.aiadvent.statements.config;

import com.aiadvent.statements.ast.TreeSitterLanguage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "statements.tree")
public class StatementTreeProperties implements InitializingBean {

  private boolean enabled = true;
  private List<String> enabledLanguages =
      Stream.of(TreeSitterLanguage.values())
          .flatMap(language -> language.languageIds().stream())
          .sorted()
          .collect(Collectors.toCollection(ArrayList::new));
  private List<String> trimmedByDefault =
      new ArrayList<>(
          List.of("javascript", "javascriptreact", "jsx", "typescript", "typescriptreact", "go"));
  private int maxConcurrency = 2;
  private Duration parseTimeout = Duration.ofSeconds(2);

  @Override
  public void afterPropertiesSet() {
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("statements.tree.max-concurrency must be >= 1");
    }
    if (parseTimeout == null || parseTimeout.isNegative()) {
      throw new IllegalArgumentException("statements.tree.parse-timeout must not be negative");
    }
    for (String languageId : enabledLanguages) {
      if (TreeSitterLanguage.fromId(languageId).isEmpty()) {
        throw new IllegalArgumentException(
            "statements.tree.enabled-languages contains unknown language '" + languageId + "'");
      }
    }
  }

  /** Normalized view of {@link #getEnabledLanguages()}. */
  public Set<String> enabledLanguageIds() {
    return normalize(enabledLanguages);
  }

  public Set<String> trimmedByDefaultIds() {
    return normalize(trimmedByDefault);
  }

  private static Set<String> normalize(List<String> ids) {
    Set<String> normalized = new LinkedHashSet<>();
    if (ids != null) {
      for (String id : ids) {
        if (StringUtils.hasText(id)) {
          normalized.add(TreeSitterLanguage.normalize(id));
        }
      }
    }
    return normalized;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public List<String> getEnabledLanguages() {
    return enabledLanguages;
  }

  public void setEnabledLanguages(List<String> enabledLanguages) {
    this.enabledLanguages = enabledLanguages != null ? new ArrayList<>(enabledLanguages) : new ArrayList<>();
  }

  public List<String> getTrimmedByDefault() {
    return trimmedByDefault;
  }

  public void setTrimmedByDefault(List<String> trimmedByDefault) {
    this.trimmedByDefault = trimmedByDefault != null ? new ArrayList<>(trimmedByDefault) : new ArrayList<>();
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public void setMaxConcurrency(int maxConcurrency) {
    this.maxConcurrency = maxConcurrency;
  }

  public Duration getParseTimeout() {
    return parseTimeout;
  }

  public void setParseTimeout(Duration parseTimeout) {
    this.parseTimeout = parseTimeout;
  }
}
