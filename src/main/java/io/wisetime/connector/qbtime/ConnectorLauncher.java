/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.wisetime.connector.qbtime.config.ConfigKey;
import io.wisetime.connector.qbtime.config.ConnectorConfig;
import io.wisetime.connector.qbtime.tool.ToolDispatcher;
import io.wisetime.connector.qbtime.tool.ToolParams;
import io.wisetime.connector.qbtime.tool.ToolResult;
import io.wisetime.connector.qbtime.util.AuthException;
import io.wisetime.connector.qbtime.util.ErrorKind;
import io.wisetime.connector.qbtime.util.ValidationException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Retrofit;
import retrofit2.converter.gson.GsonConverterFactory;

/**
 * Command line entry point. Runs a single tool call and prints its JSON result:
 *
 * <pre>
 *   qbtime-accounting-connector prepare_biweekly_payroll '{"end_date": "12/31/2024"}'
 * </pre>
 *
 * @author pascal
 */
public class ConnectorLauncher {

  private static final Logger log = LoggerFactory.getLogger(ConnectorLauncher.class);

  static final String DEFAULT_BASE_URL = "https://rest.tsheets.com/api/v1/";

  public static void main(final String... args) {
    final PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
    final ToolDispatcher dispatcher = buildInjector().getInstance(ToolDispatcher.class);
    if (args.length == 0) {
      out.println("Usage: qbtime-accounting-connector <tool> [json-parameters]");
      out.println("Tools: " + String.join(", ", dispatcher.toolNames()));
      System.exit(2);
      return;
    }

    ToolResult result;
    try {
      result = dispatcher.call(args[0], ToolParams.parse(args.length > 1 ? args[1] : null));
    } catch (ValidationException e) {
      result = ToolResult.failure(ErrorKind.VALIDATION_ERROR, e.getMessage());
    }
    out.println(result.toJson());
    System.exit(result.isSuccess() ? 0 : 1);
  }

  public static Injector buildInjector() {
    return Guice.createInjector(new ConnectorModule(), binder -> {
      // Build api client here to be able to inject it into QbTimeApiService for better testability
      OkHttpClient.Builder httpClient = new OkHttpClient.Builder();

      // Access token interceptor
      httpClient.addInterceptor(chain -> {
        Request newRequest = chain.request().newBuilder()
            .addHeader("Authorization", getAccessToken())
            .build();
        return chain.proceed(newRequest);
      });

      Retrofit retrofit = new Retrofit.Builder()
          .client(httpClient.build())
          .baseUrl(getBaseUrl())
          .addConverterFactory(GsonConverterFactory.create())
          .build();

      binder.bind(QbTimeApiService.QbTimeApi.class)
          .toInstance(retrofit.create(QbTimeApiService.QbTimeApi.class));
    });
  }

  /**
   * Configuration keys for the QuickBooks Time accounting connector.
   */
  public enum QbTimeConfigKey implements ConfigKey {

    //required
    QBT_ACCESS_TOKEN("QBT_ACCESS_TOKEN"),

    //optional
    QBT_BASE_URL("QBT_BASE_URL"),
    TIMEZONE("TIMEZONE"),
    PAGE_SIZE("PAGE_SIZE"),
    RATE_LIMIT_PER_SECOND("RATE_LIMIT_PER_SECOND"),
    RATE_LIMIT_PER_MINUTE("RATE_LIMIT_PER_MINUTE"),
    RETRY_MAX_ATTEMPTS("RETRY_MAX_ATTEMPTS"),
    RETRY_BASE_DELAY_MS("RETRY_BASE_DELAY_MS"),
    RETRY_MAX_DELAY_MS("RETRY_MAX_DELAY_MS"),
    RETRY_JITTER_MS("RETRY_JITTER_MS"),
    FISCAL_YEAR_START_MONTH("FISCAL_YEAR_START_MONTH"),
    DOUBLE_TIME_CUSTOMFIELD_ID("DOUBLE_TIME_CUSTOMFIELD_ID"),
    WEEKLY_OVERTIME_HOURS("WEEKLY_OVERTIME_HOURS"),
    WORKFLOW_TIMEOUT_SECONDS("WORKFLOW_TIMEOUT_SECONDS"),
    FETCH_THREADS("FETCH_THREADS");

    private final String configKey;

    QbTimeConfigKey(final String configKey) {
      this.configKey = configKey;
    }

    @Override
    public String getConfigKey() {
      return configKey;
    }
  }

  static String getBaseUrl() {
    final String baseUrl = ConnectorConfig.getString(QbTimeConfigKey.QBT_BASE_URL).orElse(DEFAULT_BASE_URL);
    // Retrofit resolves relative paths against the last slash
    return baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
  }

  static String getAccessToken() {
    return ConnectorConfig
        .getString(QbTimeConfigKey.QBT_ACCESS_TOKEN)
        .map(token -> "Bearer " + token)
        .orElseThrow(() -> {
          log.error("QBT_ACCESS_TOKEN is not configured");
          return new AuthException("No QuickBooks Time access token is configured. Please set QBT_ACCESS_TOKEN.");
        });
  }
}
