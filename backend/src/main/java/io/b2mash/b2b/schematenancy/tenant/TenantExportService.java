package io.b2mash.b2b.schematenancy.tenant;

import io.b2mash.b2b.schematenancy.multitenancy.ConnectionSchemaContext;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import org.springframework.stereotype.Service;

/** Tenant listing report: one {@code schema_name<TAB>domains} line per tenant. */
@Service
public class TenantExportService {

  private static final String LINE_END = "\r\n";

  private final TenantRepository tenantRepository;

  public TenantExportService(TenantRepository tenantRepository) {
    this.tenantRepository = tenantRepository;
  }

  public List<TenantListing> listTenants(ConnectionSchemaContext context) {
    return tenantRepository.findAllListings(context);
  }

  public void writeTabSeparated(List<TenantListing> listings, Writer writer) throws IOException {
    for (var listing : listings) {
      writer.write(escape(listing.schemaName()));
      writer.write('\t');
      writer.write(escape(listing.domains()));
      writer.write(LINE_END);
    }
    writer.flush();
  }

  private static String escape(String value) {
    if (value == null) {
      return "";
    }
    if (value.indexOf('\t') >= 0
        || value.indexOf('"') >= 0
        || value.indexOf('\n') >= 0
        || value.indexOf('\r') >= 0) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
