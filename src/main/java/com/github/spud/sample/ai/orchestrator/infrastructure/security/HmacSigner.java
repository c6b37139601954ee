package com.github.spud.sample.ai.orchestrator.infrastructure.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;

/**
 * HMAC-SHA256 签名与校验，签名采用 base64url 编码且不带填充
 * <p>
 * 始终对原始字节计算，调用方不应先按字符集解码再重新编码
 */
@Slf4j
public class HmacSigner {

  private static final String ALGORITHM = "HmacSHA256";

  private final byte[] key;

  public HmacSigner(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("HMAC secret must not be empty");
    }
    this.key = secret.getBytes(StandardCharsets.UTF_8);
  }

  public String sign(byte[] body) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(digest(body));
  }

  /**
   * 校验原始请求体的签名；签名缺失或无法解码时返回 false
   */
  public boolean verify(byte[] body, String signature) {
    if (signature == null || signature.isBlank()) {
      return false;
    }
    byte[] provided;
    try {
      provided = Base64.getUrlDecoder().decode(stripPadding(signature.trim()));
    } catch (IllegalArgumentException e) {
      log.debug("Signature is not valid base64url: {}", e.getMessage());
      return false;
    }
    return MessageDigest.isEqual(digest(body), provided);
  }

  private byte[] digest(byte[] body) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(key, ALGORITHM));
      return mac.doFinal(body != null ? body : new byte[0]);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to compute HMAC: " + e.getMessage(), e);
    }
  }

  private static String stripPadding(String signature) {
    int end = signature.length();
    while (end > 0 && signature.charAt(end - 1) == '=') {
      end--;
    }
    return signature.substring(0, end);
  }
}
