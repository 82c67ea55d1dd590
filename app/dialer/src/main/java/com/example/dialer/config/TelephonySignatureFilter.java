/*
 * どこで: Dialer 通話プロバイダ webhook
 * 何を: webhook の署名ヘッダ (HMAC-SHA1) を検証する
 * なぜ: 第三者が通話状態を偽装して担当者を解放/確保できないようにするため
 */
package com.example.dialer.config;

import com.google.common.annotations.VisibleForTesting;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

public class TelephonySignatureFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(TelephonySignatureFilter.class);
  static final String SIGNATURE_HEADER = "X-Twilio-Signature";
  private static final String WEBHOOK_PATH_PREFIX = "/webhooks/";
  private static final String HMAC_ALGORITHM = "HmacSHA1";

  private final TelephonyProperties properties;

  public TelephonySignatureFilter(TelephonyProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return !properties.validateSignatures() || uri == null || !uri.startsWith(WEBHOOK_PATH_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String signature = request.getHeader(SIGNATURE_HEADER);
    final String url = resolveSignedUrl(request);
    if (signature == null || !matches(sign(url, bodyParameters(request)), signature)) {
      logger.warn("webhook signature rejected path={}", request.getRequestURI());
      response.sendError(HttpServletResponse.SC_FORBIDDEN);
      return;
    }
    filterChain.doFilter(request, response);
  }

  /**
   * 役割: プロバイダと同じ手順で署名を計算する。
   *
   * <p>動作: URL の後ろにパラメータ名の昇順で名前と値を連結し、auth token で HMAC-SHA1 して Base64 にする。
   */
  @VisibleForTesting
  String sign(String url, Map<String, String> parameters) {
    final StringBuilder data = new StringBuilder(url);
    new TreeMap<>(parameters).forEach((name, value) -> data.append(name).append(value));
    try {
      final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(
          new SecretKeySpec(properties.authToken().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      return Base64.getEncoder()
          .encodeToString(mac.doFinal(data.toString().getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("failed to compute webhook signature", ex);
    }
  }

  private static boolean matches(String expected, String actual) {
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
  }

  private String resolveSignedUrl(HttpServletRequest request) {
    final String query = request.getQueryString();
    final String path = query == null ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    return properties.callbackUrl(path);
  }

  private Map<String, String> bodyParameters(HttpServletRequest request) {
    // クエリ文字列のパラメータは URL 側で署名済み
    final Set<String> queryNames = new HashSet<>();
    final String query = request.getQueryString();
    if (query != null) {
      for (String pair : query.split("&")) {
        final int eq = pair.indexOf('=');
        queryNames.add(eq < 0 ? pair : pair.substring(0, eq));
      }
    }
    final Map<String, String> parameters = new TreeMap<>();
    request
        .getParameterMap()
        .forEach(
            (name, values) -> {
              if (!queryNames.contains(name) && values.length > 0) {
                parameters.put(name, values[0]);
              }
            });
    return parameters;
  }
}
