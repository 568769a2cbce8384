package com.taildeck.backend.modules.upstream.presentation;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.global.security.authorization.RequiresMinimumRole;
import com.taildeck.backend.global.security.authorization.RequiresRoles;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.upstream.application.RouteService;
import com.taildeck.backend.modules.upstream.client.dto.RouteListResponse;
import com.taildeck.backend.modules.upstream.client.dto.RouteResponse;
import com.taildeck.backend.modules.upstream.presentation.dto.OperationResultResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/headscale/routes")
@Tag(name = "Routes", description = "서브넷/엑시트 라우트 관리")
@RequiresRoles({RoleName.OPERATOR, RoleName.ADMIN, RoleName.OWNER})
public class RouteController {

    private final RouteService routeService;

    public RouteController(RouteService routeService) {
        this.routeService = routeService;
    }

    @GetMapping
    @RequiresMinimumRole(RoleName.USER)
    @Operation(summary = "라우트 목록 조회")
    public ResponseEntity<RouteListResponse> list() {
        return ResponseEntity.ok(new RouteListResponse(routeService.listRoutes()));
    }

    @PostMapping("/{id}/enable")
    @Operation(summary = "라우트 활성화")
    public ResponseEntity<RouteResponse> enable(AuthenticatedContext context, @PathVariable("id") String id) {
        return ResponseEntity.ok(new RouteResponse(routeService.enableRoute(context, id)));
    }

    @PostMapping("/{id}/disable")
    @Operation(summary = "라우트 비활성화")
    public ResponseEntity<RouteResponse> disable(AuthenticatedContext context, @PathVariable("id") String id) {
        return ResponseEntity.ok(new RouteResponse(routeService.disableRoute(context, id)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "라우트 삭제")
    public ResponseEntity<OperationResultResponse> delete(AuthenticatedContext context, @PathVariable("id") String id) {
        routeService.deleteRoute(context, id);
        return ResponseEntity.ok(OperationResultResponse.ok());
    }
}
