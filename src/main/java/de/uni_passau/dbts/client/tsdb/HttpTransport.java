package de.uni_passau.dbts.client.tsdb;

import de.uni_passau.dbts.client.conf.Config;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base of transports talking to an HTTP API. Subclasses add authentication headers and check the
 * server's health when connecting.
 */
public abstract class HttpTransport implements Transport {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpTransport.class);

  protected final Config config;

  /** Base URL of the API, without trailing slash. */
  protected final String baseUrl;

  private OkHttpClient client;

  /**
   * Creates a transport.
   *
   * @param config Connection settings.
   * @param baseUrl Base URL of the API.
   */
  protected HttpTransport(Config config, String baseUrl) {
    this.config = config;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  @Override
  public void connect() throws TsdbException {
    OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder();
    clientBuilder
        .connectTimeout(config.CONNECT_TIMEOUT, TimeUnit.SECONDS)
        .readTimeout(config.READ_TIMEOUT, TimeUnit.SECONDS)
        .writeTimeout(config.WRITE_TIMEOUT, TimeUnit.SECONDS)
        .retryOnConnectionFailure(config.RETRY_ON_CONNECTION_FAILURE);
    client = clientBuilder.build();
    try {
      ping();
    } catch (TsdbException e) {
      close();
      throw e;
    }
    LOGGER.debug("Connected to {}", baseUrl);
  }

  /**
   * Checks that the server is available.
   *
   * @throws TsdbException if the server does not respond as expected.
   */
  protected abstract void ping() throws TsdbException;

  /**
   * Adds headers every request needs, e.g., authentication.
   *
   * @param builder Request to decorate.
   * @return The decorated request.
   */
  protected Request.Builder decorate(Request.Builder builder) {
    return builder;
  }

  @Override
  public boolean isConnected() {
    return client != null;
  }

  /**
   * Sends a GET request.
   *
   * @param url Absolute URL.
   * @return Response body.
   * @throws TsdbException if the request fails or the status is not successful.
   */
  protected String get(String url) throws TsdbException {
    return send(decorate(new Request.Builder().url(url).get()).build());
  }

  /**
   * Sends a POST request.
   *
   * @param url Absolute URL.
   * @param body Request body.
   * @param mediaType Content type of the body.
   * @return Response body.
   * @throws TsdbException if the request fails or the status is not successful.
   */
  protected String post(String url, String body, String mediaType) throws TsdbException {
    RequestBody requestBody = RequestBody.create(body, MediaType.get(mediaType));
    return send(decorate(new Request.Builder().url(url).post(requestBody)).build());
  }

  /**
   * Sends a DELETE request.
   *
   * @param url Absolute URL.
   * @return Response body.
   * @throws TsdbException if the request fails or the status is not successful.
   */
  protected String delete(String url) throws TsdbException {
    return send(decorate(new Request.Builder().url(url).delete()).build());
  }

  /**
   * Executes a request.
   *
   * @param request The request.
   * @return Response body, empty if there is none.
   * @throws TsdbException if the request fails or the status is not successful.
   */
  protected String send(Request request) throws TsdbException {
    if (client == null) {
      throw new TsdbException("Transport to " + baseUrl + " is not connected.");
    }
    try (Response response = client.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String body = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw new TsdbException(
            String.format(
                "%s %s failed with status %d: %s",
                request.method(), request.url(), response.code(), body));
      }
      return body;
    } catch (IOException e) {
      LOGGER.error("{} {} failed because ", request.method(), request.url(), e);
      throw new TsdbException(request.method() + " " + request.url() + " failed", e);
    }
  }

  @Override
  public void close() {
    if (client != null) {
      client.dispatcher().executorService().shutdown();
      client.connectionPool().evictAll();
      client = null;
    }
  }
}
