package io.vision.datadog;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings for {@link DatadogSink}.
 *
 * <pre>{@code
 * DatadogConfig config = DatadogConfig.builder(System.getenv("DD_API_KEY"), "checkout")
 *     .site(DatadogSite.EU1)
 *     .env("prod")
 *     .exportMode(ExportMode.LOG)
 *     .build();
 * }</pre>
 */
public final class DatadogConfig {
  static final int MAX_RETRIES = 5;

  private final String apiKey;
  private final String appKey;
  private final String service;
  private final DatadogSite site;
  private final URI baseUri;
  private final String env;
  private final String version;
  private final String hostname;
  private final List<String> tags;
  private final Duration timeout;
  private final int retries;
  private final int batchSize;
  private final Duration flushInterval;
  private final ExportMode exportMode;
  private final boolean includeContextData;
  private final boolean includeTiming;
  private final boolean includeErrorDetails;

  private DatadogConfig(Builder builder) {
    this.apiKey = requireText(builder.apiKey, "apiKey");
    this.service = requireText(builder.service, "service");
    this.appKey = builder.appKey;
    this.site = Objects.requireNonNull(builder.site, "site");
    this.baseUri = builder.baseUri != null ? builder.baseUri : URI.create("https://api." + site.host());
    this.env = builder.env;
    this.version = builder.version;
    this.hostname = builder.hostname;
    this.tags = List.copyOf(builder.tags);
    this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    if (builder.retries < 0 || builder.retries > MAX_RETRIES) {
      throw new IllegalArgumentException("retries must be between 0 and " + MAX_RETRIES);
    }
    this.retries = builder.retries;
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    this.batchSize = builder.batchSize;
    this.flushInterval = Objects.requireNonNull(builder.flushInterval, "flushInterval");
    if (flushInterval.isNegative() || flushInterval.isZero()) {
      throw new IllegalArgumentException("flushInterval must be > 0");
    }
    this.exportMode = Objects.requireNonNull(builder.exportMode, "exportMode");
    this.includeContextData = builder.includeContextData;
    this.includeTiming = builder.includeTiming;
    this.includeErrorDetails = builder.includeErrorDetails;
  }

  private static String requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be empty");
    }
    return value;
  }

  /**
   * @param apiKey Datadog API key, sent as {@code DD-API-KEY}
   * @param service service name reported on every span, log and event
   */
  public static Builder builder(String apiKey, String service) {
    return new Builder(apiKey, service);
  }

  public String apiKey() {
    return apiKey;
  }

  /** Application key, or {@code null} when none is configured. */
  public String appKey() {
    return appKey;
  }

  public String service() {
    return service;
  }

  public DatadogSite site() {
    return site;
  }

  /** Root of the intake API; {@code https://api.<site>} unless overridden. */
  public URI baseUri() {
    return baseUri;
  }

  public String env() {
    return env;
  }

  public String version() {
    return version;
  }

  public String hostname() {
    return hostname;
  }

  public List<String> tags() {
    return tags;
  }

  /**
   * Tags attached to every payload: the configured {@link #tags()} followed by
   * {@code env:<env>} and {@code version:<version>} when those are set.
   */
  public List<String> globalTags() {
    List<String> result = new ArrayList<>(tags);
    if (env != null) {
      result.add("env:" + env);
    }
    if (version != null) {
      result.add("version:" + version);
    }
    return result;
  }

  public Duration timeout() {
    return timeout;
  }

  public int retries() {
    return retries;
  }

  public int batchSize() {
    return batchSize;
  }

  public Duration flushInterval() {
    return flushInterval;
  }

  public ExportMode exportMode() {
    return exportMode;
  }

  public boolean includeContextData() {
    return includeContextData;
  }

  public boolean includeTiming() {
    return includeTiming;
  }

  public boolean includeErrorDetails() {
    return includeErrorDetails;
  }

  /** Builder for {@link DatadogConfig}. */
  public static final class Builder {
    private final String apiKey;
    private final String service;
    private String appKey;
    private DatadogSite site = DatadogSite.US1;
    private URI baseUri;
    private String env;
    private String version;
    private String hostname;
    private final List<String> tags = new ArrayList<>();
    private Duration timeout = Duration.ofSeconds(10);
    private int retries = 3;
    private int batchSize = 100;
    private Duration flushInterval = Duration.ofSeconds(5);
    private ExportMode exportMode = ExportMode.TRACE;
    private boolean includeContextData = true;
    private boolean includeTiming = true;
    private boolean includeErrorDetails = true;

    private Builder(String apiKey, String service) {
      this.apiKey = apiKey;
      this.service = service;
    }

    /**
     * Sets the application key, sent as {@code DD-APPLICATION-KEY}.
     *
     * <p>Optional.
     */
    public Builder appKey(String appKey) {
      this.appKey = appKey;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link DatadogSite#US1}.
     */
    public Builder site(DatadogSite site) {
      this.site = site;
      return this;
    }

    /**
     * Overrides the intake root, e.g. to go through a proxy.
     *
     * <p>Optional. Defaults to {@code https://api.<site>}.
     */
    public Builder baseUri(URI baseUri) {
      this.baseUri = baseUri;
      return this;
    }

    public Builder env(String env) {
      this.env = env;
      return this;
    }

    public Builder version(String version) {
      this.version = version;
      return this;
    }

    /**
     * Sets the host reported on metrics, logs and events.
     *
     * <p>Optional. Omitted from payloads when unset.
     */
    public Builder hostname(String hostname) {
      this.hostname = hostname;
      return this;
    }

    /**
     * Adds a {@code key:value} tag to every payload.
     */
    public Builder tag(String tag) {
      this.tags.add(Objects.requireNonNull(tag, "tag"));
      return this;
    }

    public Builder tags(List<String> tags) {
      tags.forEach(this::tag);
      return this;
    }

    /**
     * Sets the connect and request timeout of each HTTP call.
     *
     * <p>Optional. Defaults to 10 seconds.
     */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Sets how many times a failed batch is re-delivered.
     *
     * <p>Optional. Defaults to {@code 3}. Must be between 0 and 5.
     */
    public Builder retries(int retries) {
      this.retries = retries;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 100}.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the longest time a payload waits in the queue before it is sent.
     *
     * <p>Optional. Defaults to 5 seconds.
     */
    public Builder flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link ExportMode#TRACE}.
     */
    public Builder exportMode(ExportMode exportMode) {
      this.exportMode = exportMode;
      return this;
    }

    /**
     * Whether unit data is copied into span meta, tags or log attributes.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder includeContextData(boolean includeContextData) {
      this.includeContextData = includeContextData;
      return this;
    }

    /**
     * Whether logs carry a {@code duration} attribute.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder includeTiming(boolean includeTiming) {
      this.includeTiming = includeTiming;
      return this;
    }

    /**
     * Whether failures carry the error name, message and stack.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder includeErrorDetails(boolean includeErrorDetails) {
      this.includeErrorDetails = includeErrorDetails;
      return this;
    }

    /**
     * @throws NullPointerException if {@code apiKey} or {@code service} is null
     * @throws IllegalArgumentException if a key is blank or a limit is out of range
     */
    public DatadogConfig build() {
      return new DatadogConfig(this);
    }
  }
}
