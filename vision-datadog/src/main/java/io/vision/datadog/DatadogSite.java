package io.vision.datadog;

/**
 * Datadog regions the sink can export to.
 */
public enum DatadogSite {
  US1("datadoghq.com"),
  EU1("datadoghq.eu"),
  US3("us3.datadoghq.com"),
  US5("us5.datadoghq.com"),
  AP1("ap1.datadoghq.com");

  private final String host;

  DatadogSite(String host) {
    this.host = host;
  }

  /**
   * @return the site domain, e.g. {@code datadoghq.eu}
   */
  public String host() {
    return host;
  }

  /**
   * Resolves a site from its domain or its constant name, ignoring case.
   *
   * @param value a domain such as {@code us3.datadoghq.com}, or a name such as {@code US3}
   * @return the matching site
   * @throws IllegalArgumentException if no site matches
   */
  public static DatadogSite fromHost(String value) {
    for (DatadogSite site : values()) {
      if (site.host.equalsIgnoreCase(value) || site.name().equalsIgnoreCase(value)) {
        return site;
      }
    }
    throw new IllegalArgumentException("Unknown Datadog site: " + value);
  }
}
