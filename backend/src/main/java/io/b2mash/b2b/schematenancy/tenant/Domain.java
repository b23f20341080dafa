package io.b2mash.b2b.schematenancy.tenant;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/** Maps a host name to the tenant that owns it. Always held in lowercase. */
public class Domain {

  private final UUID id;
  private final String domain;
  private final UUID tenantId;

  public Domain(UUID id, String domain, UUID tenantId) {
    this.id = id;
    this.domain = normalize(domain);
    this.tenantId = tenantId;
  }

  public static String normalize(String domain) {
    return Objects.requireNonNull(domain, "domain").toLowerCase(Locale.ROOT);
  }

  public UUID getId() {
    return id;
  }

  public String getDomain() {
    return domain;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  @Override
  public String toString() {
    return domain;
  }
}
