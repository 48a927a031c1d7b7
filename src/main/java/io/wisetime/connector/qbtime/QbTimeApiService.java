/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.wisetime.connector.qbtime.model.ApiPage;
import io.wisetime.connector.qbtime.model.Employee;
import io.wisetime.connector.qbtime.util.AuthException;
import io.wisetime.connector.qbtime.util.RateLimitExceededException;
import io.wisetime.connector.qbtime.util.ServerException;
import io.wisetime.connector.qbtime.util.ValidationException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.POST;
import retrofit2.http.Path;
import retrofit2.http.QueryMap;

/**
 * Service class to communicate with QuickBooks Time. Translates HTTP outcomes into connector exceptions and
 * parses list responses into {@link ApiPage}s.
 *
 * @author pascal
 */
public class QbTimeApiService {

  private static final Logger log = LoggerFactory.getLogger(QbTimeApiService.class);

  @Inject
  private QbTimeApi qbTimeApi;

  private final Gson entityParser;

  public QbTimeApiService() {
    entityParser = new GsonBuilder().create();
  }

  /**
   * Requests a single page of a list endpoint. Records are read from {@code results.<resultsKey>}, which the service
   * returns as an object keyed by record id.
   */
  public <T> ApiPage<T> getPage(String endpoint, String resultsKey, Class<T> recordType, Map<String, String> filters) {
    final JsonObject response = executeCall(qbTimeApi.list(endpoint, filters));
    return parsePage(response, resultsKey, recordType);
  }

  /**
   * Requests an endpoint that answers with a single object under {@code results.<resultsKey>}.
   */
  public JsonObject getResult(String endpoint, String resultsKey, Map<String, String> filters) {
    return resultOf(executeCall(qbTimeApi.list(endpoint, filters)), resultsKey);
  }

  /**
   * Runs a report. QuickBooks Time expects the report parameters wrapped in a {@code data} object.
   */
  public JsonObject postReport(String endpoint, String resultsKey, JsonObject parameters) {
    final JsonObject body = new JsonObject();
    body.add("data", parameters);
    return resultOf(executeCall(qbTimeApi.report(endpoint, body)), resultsKey);
  }

  public Employee getCurrentUser() {
    final JsonObject response = executeCall(qbTimeApi.currentUser());
    final List<Employee> users = parsePage(response, "users", Employee.class).getRecords();
    if (users.isEmpty()) {
      throw new ServerException("QuickBooks Time did not return the current user.");
    }
    return users.get(0);
  }

  public boolean canConnect() {
    try {
      getCurrentUser();
      return true;
    } catch (Exception e) {
      log.error("Error while trying to connect to QuickBooks Time: {}", e.getMessage());
      return false;
    }
  }

  @VisibleForTesting
  <T> ApiPage<T> parsePage(JsonObject response, String resultsKey, Class<T> recordType) {
    final ImmutableList.Builder<T> records = ImmutableList.builder();
    try {
      Optional.ofNullable(response.getAsJsonObject("results"))
          .map(results -> results.get(resultsKey))
          .ifPresent(collection -> {
            if (collection.isJsonObject()) {
              collection.getAsJsonObject().entrySet()
                  .forEach(entry -> records.add(entityParser.fromJson(entry.getValue(), recordType)));
            } else if (collection.isJsonArray()) {
              // an empty result set comes back as [] rather than {}
              collection.getAsJsonArray().forEach(item -> records.add(entityParser.fromJson(item, recordType)));
            }
          });
    } catch (JsonParseException | ClassCastException | IllegalStateException e) {
      throw new ServerException("QuickBooks Time returned a response that could not be read.", e);
    }

    final JsonElement more = response.get("more");
    final JsonElement supplemental = response.get("supplemental_data");
    return new ApiPage<T>()
        .setRecords(records.build())
        .setMore(more != null && more.isJsonPrimitive() && more.getAsBoolean())
        .setSupplementalData(
            supplemental != null && supplemental.isJsonObject() ? supplemental.getAsJsonObject() : null);
  }

  private static JsonObject resultOf(JsonObject response, String resultsKey) {
    final JsonObject results = response.getAsJsonObject("results");
    final JsonElement result = results == null ? null : results.get(resultsKey);
    if (result == null || !result.isJsonObject()) {
      throw new ServerException("QuickBooks Time returned no " + resultsKey + " data.");
    }
    return result.getAsJsonObject();
  }

  <T> T executeCall(Call<T> call) {
    final retrofit2.Response<T> response;
    try {
      response = call.execute();
    } catch (IOException e) {
      log.warn("Request to QuickBooks Time failed without a response: {}", e.getMessage());
      throw new ServerException("No response received from QuickBooks Time. Please try again later.", e);
    }
    if (response.isSuccessful() && response.body() != null) {
      return response.body();
    }
    if (response.isSuccessful()) {
      throw new ServerException("There was an unexpected error when trying to connect to QuickBooks Time.");
    }

    final String errorBody = readErrorBody(response);
    final String serviceMessage = extractErrorMessage(errorBody).orElse(response.message());
    log.error("Request {} failed with code {} and message {}", call.request(), response.code(), errorBody);

    final int code = response.code();
    if (code == HttpStatus.SC_UNAUTHORIZED) {
      throw new AuthException("Your QuickBooks Time connection has expired. Please reconnect your account.");
    }
    if (code == HttpStatus.SC_FORBIDDEN) {
      throw new AuthException("You don't have permission to access this information. "
          + "Please contact your QuickBooks Time administrator.");
    }
    if (code == 429) {
      throw new RateLimitExceededException("Too many requests to QuickBooks Time. Please wait a moment and try again.");
    }
    if (code >= HttpStatus.SC_INTERNAL_SERVER_ERROR) {
      throw new ServerException("QuickBooks Time is currently unavailable (" + code + "). Please try again later.");
    }
    throw new ValidationException("QuickBooks Time rejected the request (" + code + "): " + serviceMessage);
  }

  private static String readErrorBody(retrofit2.Response<?> response) {
    // prevent potential null pointer exception
    if (response.errorBody() == null) {
      return "";
    }
    try {
      return response.errorBody().string();
    } catch (IOException e) {
      log.debug("Unable to read error body", e);
      return "";
    }
  }

  /**
   * QuickBooks Time reports errors as {@code {"error": {"code": 417, "message": "..."}}}.
   */
  private static Optional<String> extractErrorMessage(String errorBody) {
    try {
      final JsonElement parsed = JsonParser.parseString(errorBody);
      if (!parsed.isJsonObject() || !parsed.getAsJsonObject().has("error")) {
        return Optional.empty();
      }
      final JsonElement error = parsed.getAsJsonObject().get("error");
      if (error.isJsonObject() && error.getAsJsonObject().has("message")) {
        return Optional.of(error.getAsJsonObject().get("message").getAsString());
      }
      return Optional.empty();
    } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
      return Optional.empty();
    }
  }

  public interface QbTimeApi {

    @GET("{endpoint}")
    Call<JsonObject> list(@Path(value = "endpoint", encoded = true) String endpoint,
                          @QueryMap Map<String, String> filters);

    @POST("{endpoint}")
    Call<JsonObject> report(@Path(value = "endpoint", encoded = true) String endpoint, @Body JsonObject body);

    @GET("current_user")
    Call<JsonObject> currentUser();
  }
}
