package io.b2mash.b2b.schematenancy.tenant;

import io.b2mash.b2b.schematenancy.introspection.ConstraintInfo;
import io.b2mash.b2b.schematenancy.introspection.SchemaIntrospector;
import io.b2mash.b2b.schematenancy.introspection.TableInfo;
import io.b2mash.b2b.schematenancy.multitenancy.ConnectionSchemaContext;
import io.b2mash.b2b.schematenancy.multitenancy.SchemaContextFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Internal tenant administration. Every request works on its own schema context. */
@RestController
@RequestMapping("/internal/tenants")
public class TenantController {

  private static final Logger log = LoggerFactory.getLogger(TenantController.class);

  static final MediaType TAB_SEPARATED_VALUES =
      MediaType.parseMediaType("text/tab-separated-values");

  private final SchemaContextFactory schemaContexts;
  private final TenantService tenantService;
  private final TenantResolver tenantResolver;
  private final TenantExportService tenantExportService;
  private final SchemaIntrospector schemaIntrospector;

  public TenantController(
      SchemaContextFactory schemaContexts,
      TenantService tenantService,
      TenantResolver tenantResolver,
      TenantExportService tenantExportService,
      SchemaIntrospector schemaIntrospector) {
    this.schemaContexts = schemaContexts;
    this.tenantService = tenantService;
    this.tenantResolver = tenantResolver;
    this.tenantExportService = tenantExportService;
    this.schemaIntrospector = schemaIntrospector;
  }

  @PostMapping
  public ResponseEntity<TenantResponse> createTenant(
      @Valid @RequestBody CreateTenantRequest request) {
    log.info("Received tenant creation request for schema {}", request.schemaName());
    try (var context = schemaContexts.open()) {
      var tenant = new Tenant(request.schemaName(), request.name());
      if (request.autoCreateSchema() != null) {
        tenant.setAutoCreateSchema(request.autoCreateSchema());
      }
      if (request.autoDropSchema() != null) {
        tenant.setAutoDropSchema(request.autoDropSchema());
      }
      tenantService.create(
          context, tenant, request.domains() != null ? request.domains() : List.of());

      return ResponseEntity.created(URI.create("/internal/tenants/" + tenant.getSchemaName()))
          .body(toResponse(context, tenant));
    }
  }

  @GetMapping
  public ResponseEntity<List<TenantListing>> listTenants() {
    try (var context = schemaContexts.open()) {
      return ResponseEntity.ok(tenantExportService.listTenants(context));
    }
  }

  @GetMapping("/export")
  public ResponseEntity<String> exportTenants() {
    var writer = new StringWriter();
    try (var context = schemaContexts.open()) {
      tenantExportService.writeTabSeparated(tenantExportService.listTenants(context), writer);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return ResponseEntity.ok().contentType(TAB_SEPARATED_VALUES).body(writer.toString());
  }

  @GetMapping("/resolve")
  public ResponseEntity<TenantResponse> resolveTenant(@RequestParam String domain) {
    try (var context = schemaContexts.open()) {
      var tenant = tenantResolver.getForDomain(context, domain);
      return ResponseEntity.ok(toResponse(context, tenant));
    }
  }

  @GetMapping("/{schemaName}")
  public ResponseEntity<TenantResponse> getTenant(@PathVariable String schemaName) {
    try (var context = schemaContexts.open()) {
      var tenant = tenantService.requireBySchemaName(context, schemaName);
      return ResponseEntity.ok(toResponse(context, tenant));
    }
  }

  @PatchMapping("/{schemaName}")
  public ResponseEntity<TenantResponse> updateTenant(
      @PathVariable String schemaName, @Valid @RequestBody UpdateTenantRequest request) {
    try (var context = schemaContexts.open()) {
      var tenant = tenantService.requireBySchemaName(context, schemaName);
      if (request.name() != null) {
        tenant.rename(request.name());
      }
      if (request.autoDropSchema() != null) {
        tenant.setAutoDropSchema(request.autoDropSchema());
      }
      tenantService.save(context, tenant);
      return ResponseEntity.ok(toResponse(context, tenant));
    }
  }

  @DeleteMapping("/{schemaName}")
  public ResponseEntity<Void> deleteTenant(
      @PathVariable String schemaName,
      @RequestParam(defaultValue = "false") boolean dropSchema) {
    try (var context = schemaContexts.open()) {
      var tenant = tenantService.requireBySchemaName(context, schemaName);
      tenantService.delete(context, tenant, dropSchema);
    }
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{schemaName}/domains")
  public ResponseEntity<DomainResponse> addDomain(
      @PathVariable String schemaName, @Valid @RequestBody AddDomainRequest request) {
    try (var context = schemaContexts.open()) {
      var tenant = tenantService.requireBySchemaName(context, schemaName);
      var domain = tenantService.addDomain(context, tenant, request.domain());
      return ResponseEntity.created(
              URI.create("/internal/tenants/" + tenant.getSchemaName() + "/domains/" + domain))
          .body(new DomainResponse(domain.getDomain(), tenant.getSchemaName()));
    }
  }

  @DeleteMapping("/{schemaName}/domains/{domain}")
  public ResponseEntity<Void> removeDomain(
      @PathVariable String schemaName, @PathVariable String domain) {
    try (var context = schemaContexts.open()) {
      var tenant = tenantService.requireBySchemaName(context, schemaName);
      if (tenantService.removeDomain(context, tenant, domain) == 0) {
        return ResponseEntity.notFound().build();
      }
    }
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{schemaName}/tables")
  public ResponseEntity<List<TableInfo>> listTables(@PathVariable String schemaName) {
    try (var context = schemaContexts.open()) {
      switchToTenant(context, schemaName);
      return ResponseEntity.ok(schemaIntrospector.listTables(context));
    }
  }

  @GetMapping("/{schemaName}/tables/{table}/constraints")
  public ResponseEntity<Map<String, ConstraintInfo>> getConstraints(
      @PathVariable String schemaName, @PathVariable String table) {
    try (var context = schemaContexts.open()) {
      switchToTenant(context, schemaName);
      return ResponseEntity.ok(schemaIntrospector.getConstraints(context, table));
    }
  }

  private TenantResponse toResponse(ConnectionSchemaContext context, Tenant tenant) {
    return TenantResponse.from(tenant, tenantService.getDomains(context, tenant));
  }

  private void switchToTenant(ConnectionSchemaContext context, String schemaName) {
    var tenant = tenantService.requireBySchemaName(context, schemaName);
    context.setSchema(tenant.getSchemaName(), true);
  }

  public record CreateTenantRequest(
      @NotBlank(message = "schemaName is required") @Size(max = 63) String schemaName,
      @NotBlank(message = "name is required") @Size(max = 100) String name,
      Boolean autoCreateSchema,
      Boolean autoDropSchema,
      List<@NotBlank @Size(max = 128) String> domains) {}

  public record UpdateTenantRequest(
      @Size(min = 1, max = 100) String name, Boolean autoDropSchema) {}

  public record AddDomainRequest(
      @NotBlank(message = "domain is required") @Size(max = 128) String domain) {}

  public record DomainResponse(String domain, String schemaName) {}

  public record TenantResponse(
      UUID id,
      String schemaName,
      String name,
      LocalDate createdOn,
      boolean autoCreateSchema,
      boolean autoDropSchema,
      List<String> domains) {

    public static TenantResponse from(Tenant tenant, List<String> domains) {
      return new TenantResponse(
          tenant.getId(),
          tenant.getSchemaName(),
          tenant.getName(),
          tenant.getCreatedOn(),
          tenant.isAutoCreateSchema(),
          tenant.isAutoDropSchema(),
          domains);
    }
  }
}
