package com.taildeck.backend.modules.upstream.application;

import java.util.List;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.modules.audit.application.AuditActor;
import com.taildeck.backend.modules.audit.application.AuditEntry;
import com.taildeck.backend.modules.audit.application.AuditLogService;
import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;
import com.taildeck.backend.modules.upstream.client.GatewayResult;
import com.taildeck.backend.modules.upstream.client.UpstreamClient;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamNode;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamRoute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RouteService {

    private static final Logger log = LoggerFactory.getLogger(RouteService.class);

    static final String RESOURCE = "Route";

    private final UpstreamClient upstreamClient;
    private final AuditLogService auditLogService;
    private final GatewayErrorTranslator errorTranslator;

    public RouteService(UpstreamClient upstreamClient, AuditLogService auditLogService,
                        GatewayErrorTranslator errorTranslator) {
        this.upstreamClient = upstreamClient;
        this.auditLogService = auditLogService;
        this.errorTranslator = errorTranslator;
    }

    public List<UpstreamRoute> listRoutes() {
        return unwrap(upstreamClient.listRoutes());
    }

    public UpstreamRoute enableRoute(AuthenticatedContext context, String routeId) {
        UpstreamRoute route = unwrap(upstreamClient.enableRoute(routeId));
        auditToggle(AuditAction.ENABLE_ROUTE, context, routeId, route);
        log.info("Route {} enabled by {}", routeId, context.userId());
        return route;
    }

    public UpstreamRoute disableRoute(AuthenticatedContext context, String routeId) {
        UpstreamRoute route = unwrap(upstreamClient.disableRoute(routeId));
        auditToggle(AuditAction.DISABLE_ROUTE, context, routeId, route);
        log.info("Route {} disabled by {}", routeId, context.userId());
        return route;
    }

    public void deleteRoute(AuthenticatedContext context, String routeId) {
        unwrap(upstreamClient.deleteRoute(routeId));
        auditLogService.logAudit(
                AuditEntry.of(AuditAction.DELETE_ROUTE, AuditActor.from(context), AuditResourceType.ROUTE, routeId));
        log.info("Route {} deleted by {}", routeId, context.userId());
    }

    private void auditToggle(AuditAction action, AuthenticatedContext context, String routeId, UpstreamRoute route) {
        UpstreamNode node = route != null ? route.node() : null;
        auditLogService.logAudit(AuditEntry.of(action, AuditActor.from(context), AuditResourceType.ROUTE, routeId)
                .withNewValue(AuditValues.of("enabled", route != null ? route.enabled() : null))
                .withMetadata(AuditValues.of(
                        "prefix", route != null ? route.prefix() : null,
                        "nodeId", node != null ? node.id() : null,
                        "nodeName", node != null ? node.displayName() : null)));
    }

    private <T> T unwrap(GatewayResult<T> result) {
        return result.orElseThrow(error -> errorTranslator.translate(error, RESOURCE));
    }
}
