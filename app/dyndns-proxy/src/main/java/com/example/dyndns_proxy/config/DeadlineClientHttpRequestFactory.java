/*
 * どこで: DynDNS プロキシ設定
 * 何を: 接続から応答本文の受信完了までを 1 つの期限で打ち切る ClientHttpRequestFactory
 * なぜ: ヘッダー送信後に本文が止まる相手でも、呼び出しを timeout 内で TIMEOUT として終えるため
 */
package com.example.dyndns_proxy.config;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.AbstractClientHttpRequest;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpResponse;

/**
 * 役割:
 * - JDK HttpClient で 1 往復を実行し、応答本文をメモリへ読み切ってから返す。
 *
 * 期待動作:
 * - 接続・ヘッダー待ち・本文受信の合計が timeout を超えたら交換を取り消し、
 *   {@link HttpTimeoutException} を投げる。
 * - 接続失敗などの I/O 例外はそのまま投げ、RestClient 側で ResourceAccessException になる。
 */
class DeadlineClientHttpRequestFactory implements ClientHttpRequestFactory {

  // JDK HttpClient が自前で管理し、設定すると IllegalArgumentException になるヘッダー。
  private static final Set<String> RESTRICTED_HEADERS =
      Set.of("connection", "content-length", "expect", "host", "upgrade");

  private final HttpClient httpClient;
  private final Duration timeout;

  DeadlineClientHttpRequestFactory(HttpClient httpClient, Duration timeout) {
    this.httpClient = httpClient;
    this.timeout = timeout;
  }

  @Override
  public ClientHttpRequest createRequest(URI uri, HttpMethod httpMethod) {
    return new DeadlineClientHttpRequest(uri, httpMethod);
  }

  private final class DeadlineClientHttpRequest extends AbstractClientHttpRequest {

    private final URI uri;
    private final HttpMethod method;
    private final ByteArrayOutputStream body = new ByteArrayOutputStream(256);

    private DeadlineClientHttpRequest(URI uri, HttpMethod method) {
      this.uri = uri;
      this.method = method;
    }

    @Override
    public HttpMethod getMethod() {
      return method;
    }

    @Override
    public URI getURI() {
      return uri;
    }

    @Override
    protected OutputStream getBodyInternal(HttpHeaders headers) {
      return body;
    }

    @Override
    protected ClientHttpResponse executeInternal(HttpHeaders headers) throws IOException {
      final CompletableFuture<HttpResponse<byte[]>> future =
          httpClient.sendAsync(buildRequest(headers), HttpResponse.BodyHandlers.ofByteArray());
      try {
        final HttpResponse<byte[]> response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return new BufferedClientHttpResponse(response);
      } catch (TimeoutException ex) {
        future.cancel(true);
        throw new HttpTimeoutException(
            method + " " + uri.getPath() + " did not complete within " + timeout);
      } catch (InterruptedException ex) {
        future.cancel(true);
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("interrupted while waiting for " + uri.getPath());
      } catch (ExecutionException ex) {
        final Throwable cause = ex.getCause();
        if (cause instanceof IOException ioException) {
          throw ioException;
        }
        throw new IOException("request to " + uri.getPath() + " failed", cause);
      }
    }

    private HttpRequest buildRequest(HttpHeaders headers) {
      final HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(timeout);
      headers.forEach(
          (name, values) -> {
            if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
              return;
            }
            values.forEach(value -> builder.header(name, value));
          });
      final byte[] bytes = body.toByteArray();
      final HttpRequest.BodyPublisher publisher =
          bytes.length == 0
              ? HttpRequest.BodyPublishers.noBody()
              : HttpRequest.BodyPublishers.ofByteArray(bytes);
      return builder.method(method.name(), publisher).build();
    }
  }

  private static final class BufferedClientHttpResponse implements ClientHttpResponse {

    private final HttpResponse<byte[]> response;
    private final HttpHeaders headers = new HttpHeaders();

    private BufferedClientHttpResponse(HttpResponse<byte[]> response) {
      this.response = response;
      response
          .headers()
          .map()
          .forEach(
              (name, values) -> {
                if (!name.startsWith(":")) {
                  headers.addAll(name, values);
                }
              });
    }

    @Override
    public HttpStatusCode getStatusCode() {
      return HttpStatusCode.valueOf(response.statusCode());
    }

    @Override
    public String getStatusText() {
      final HttpStatus status = HttpStatus.resolve(response.statusCode());
      return status != null ? status.getReasonPhrase() : "";
    }

    @Override
    public HttpHeaders getHeaders() {
      return headers;
    }

    @Override
    public InputStream getBody() {
      final byte[] bytes = response.body();
      return new ByteArrayInputStream(bytes != null ? bytes : new byte[0]);
    }

    @Override
    public void close() {
      // 本文は読み切り済みで解放する接続資源はない
    }
  }
}
