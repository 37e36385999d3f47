package io.vaultledger.holdersbackend.error;

import java.util.Map;

/** Terminal failure of one holders request. Never retried inside the service. */
public class HoldersException extends RuntimeException {
  private final HoldersErrorCode code;
  private final int httpStatus;
  private final Map<String, Object> details;

  public HoldersException(HoldersErrorCode code, String message, int httpStatus) {
    this(code, message, httpStatus, Map.of(), null);
  }

  public HoldersException(
      HoldersErrorCode code, String message, int httpStatus, Map<String, Object> details) {
    this(code, message, httpStatus, details, null);
  }

  public HoldersException(
      HoldersErrorCode code,
      String message,
      int httpStatus,
      Map<String, Object> details,
      Throwable cause) {
    super(message, cause);
    this.code = code;
    this.httpStatus = httpStatus;
    this.details = details == null ? Map.of() : details;
  }

  public static HoldersException vaultNotFound(String field, String value) {
    return new HoldersException(
        HoldersErrorCode.VAULT_NOT_FOUND,
        "Vault with \"" + field + "\" " + value + " not found",
        404,
        Map.of(field, value));
  }

  public static HoldersException vaultNotUnique(String field, String value, int matches) {
    return new HoldersException(
        HoldersErrorCode.VAULT_NOT_UNIQUE,
        "Vault with \"" + field + "\" " + value + " is not unique (" + matches + " matches)",
        409,
        Map.of(field, value, "matches", matches));
  }

  public static HoldersException metadataMissing(String tokenId, String field) {
    return new HoldersException(
        HoldersErrorCode.TOKEN_METADATA_MISSING,
        "Token " + tokenId + " has no " + field,
        500,
        Map.of("token", tokenId, "field", field));
  }

  public static HoldersException indexerQueryFailed(String query, String reason, Throwable cause) {
    return new HoldersException(
        HoldersErrorCode.INDEXER_QUERY_FAILED,
        query + " failed: " + reason,
        502,
        Map.of("query", query),
        cause);
  }

  public HoldersErrorCode getCode() {
    return code;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public Map<String, Object> getDetails() {
    return details;
  }
}
