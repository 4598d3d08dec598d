package com.arbor.hierarchy.api;

import static com.arbor.hierarchy.api.RequestContextResolver.ACTOR_HEADER;
import static com.arbor.hierarchy.api.RequestContextResolver.TENANT_HEADER;

import com.arbor.hierarchy.api.dto.CreateNodeRequest;
import com.arbor.hierarchy.api.dto.MoveNodeRequest;
import com.arbor.hierarchy.api.dto.NodeResponse;
import com.arbor.hierarchy.api.dto.RenameNodeRequest;
import com.arbor.hierarchy.domain.model.ConsistencyReport;
import com.arbor.hierarchy.domain.model.CreateNodeCommand;
import com.arbor.hierarchy.domain.model.HierarchyStats;
import com.arbor.hierarchy.domain.model.Node;
import com.arbor.hierarchy.domain.model.NodeFilter;
import com.arbor.hierarchy.domain.model.NodeKind;
import com.arbor.hierarchy.domain.model.NodeMetadata;
import com.arbor.hierarchy.domain.services.HierarchyEngine;
import com.arbor.security.ArborSecurityContext;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the hierarchy engine. Thin: resolves the caller's identity, delegates, maps to
 * wire records. Failures are translated by
 * {@link com.arbor.hierarchy.infrastructure.web.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/nodes")
public class HierarchyController {

    private final HierarchyEngine engine;
    private final RequestContextResolver contextResolver;

    public HierarchyController(HierarchyEngine engine, RequestContextResolver contextResolver) {
        this.engine = engine;
        this.contextResolver = contextResolver;
    }

    /** Creates a node. Without a tenant header (and without parent) a new tenant is established. */
    @PostMapping
    public ResponseEntity<NodeResponse> create(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody CreateNodeRequest request) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        Node created = engine.create(new CreateNodeCommand(
                request.name(),
                request.kind(),
                request.parentId(),
                ctx.tenantId().orElse(null),
                NodeMetadata.of(request.metadata())), ctx.actorId());
        return ResponseEntity.created(URI.create("/api/v1/nodes/" + created.id()))
                .body(NodeResponse.from(created));
    }

    @GetMapping("/{id}")
    public NodeResponse findById(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String id) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return NodeResponse.from(engine.findById(ctx.requireTenantId(), id));
    }

    @GetMapping
    public List<NodeResponse> findAll(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestParam(required = false) NodeKind kind,
            @RequestParam(required = false) String parentId,
            @RequestParam(required = false) Integer level,
            @RequestParam(required = false) String search) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        NodeFilter filter = new NodeFilter(kind, parentId, level, null, search);
        return NodeResponse.fromAll(engine.findAll(ctx.requireTenantId(), filter));
    }

    @GetMapping("/hierarchy")
    public List<NodeResponse> findHierarchy(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestParam(required = false) Integer maxDepth) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return NodeResponse.fromAll(engine.findHierarchy(ctx.requireTenantId(), maxDepth));
    }

    @GetMapping("/{id}/children")
    public List<NodeResponse> findChildren(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String id) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return NodeResponse.fromAll(engine.findChildren(ctx.requireTenantId(), id));
    }

    @GetMapping("/{id}/ancestors")
    public List<NodeResponse> findAncestors(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String id) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return NodeResponse.fromAll(engine.findAncestors(ctx.requireTenantId(), id));
    }

    @GetMapping("/{id}/descendants")
    public List<NodeResponse> findDescendants(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String id) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return NodeResponse.fromAll(engine.findDescendants(ctx.requireTenantId(), id));
    }

    @GetMapping("/search/by-path")
    public List<NodeResponse> findByPathPrefix(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestParam String prefix) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return NodeResponse.fromAll(engine.findByPathPrefix(ctx.requireTenantId(), prefix));
    }

    @GetMapping("/stats")
    public HierarchyStats statistics(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return engine.statistics(ctx.requireTenantId());
    }

    @GetMapping("/consistency")
    public ConsistencyReport verify(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return engine.verify(ctx.requireTenantId());
    }

    @PatchMapping("/{id}/name")
    public NodeResponse rename(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String id,
            @Valid @RequestBody RenameNodeRequest request) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return NodeResponse.from(engine.rename(ctx.requireTenantId(), id, request.name(), ctx.actorId()));
    }

    @PostMapping("/{id}/move")
    public NodeResponse move(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String id,
            @RequestBody MoveNodeRequest request) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return NodeResponse.from(engine.move(ctx.requireTenantId(), id, request.parentId(), ctx.actorId()));
    }

    @PostMapping("/{id}/repair")
    public List<NodeResponse> repair(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String id) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        return NodeResponse.fromAll(engine.repair(ctx.requireTenantId(), id, ctx.actorId()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @PathVariable String id) {
        ArborSecurityContext ctx = contextResolver.resolve(tenantId, actorId);
        engine.delete(ctx.requireTenantId(), id, ctx.actorId());
        return ResponseEntity.noContent().build();
    }
}
