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
import com.taildeck.backend.modules.upstream.client.dto.DnsResponse;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamRequests;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DnsService {

    private static final Logger log = LoggerFactory.getLogger(DnsService.class);

    static final String RESOURCE = "DNS configuration";
    static final String AUDIT_RESOURCE_ID = "config";

    private final UpstreamClient upstreamClient;
    private final AuditLogService auditLogService;
    private final GatewayErrorTranslator errorTranslator;

    public DnsService(UpstreamClient upstreamClient, AuditLogService auditLogService,
                      GatewayErrorTranslator errorTranslator) {
        this.upstreamClient = upstreamClient;
        this.auditLogService = auditLogService;
        this.errorTranslator = errorTranslator;
    }

    public DnsResponse getDns() {
        return unwrap(upstreamClient.getDns());
    }

    /**
     * 전달된 필드만 갱신한다. 업스트림이 성공한 경우에만 UPDATE_DNS 감사 항목을 남긴다.
     */
    public DnsResponse updateDns(AuthenticatedContext context, UpdateDnsCommand command) {
        DnsResponse updated = unwrap(upstreamClient.setDns(new UpstreamRequests.SetDns(
                command.nameservers(), command.domains(), command.magicDns(), command.baseDomain())));
        auditLogService.logAudit(
                AuditEntry.of(AuditAction.UPDATE_DNS, AuditActor.from(context), AuditResourceType.DNS, AUDIT_RESOURCE_ID)
                        .withNewValue(updated.dns())
                        .withMetadata(AuditValues.of(
                                "nameserversCount", sizeOf(command.nameservers()),
                                "domainsCount", sizeOf(command.domains()),
                                "magicDNS", command.magicDns(),
                                "baseDomain", command.baseDomain())));
        log.info("DNS configuration updated by {}", context.userId());
        return updated;
    }

    private static int sizeOf(List<String> values) {
        return values == null ? 0 : values.size();
    }

    private <T> T unwrap(GatewayResult<T> result) {
        return result.orElseThrow(error -> errorTranslator.translate(error, RESOURCE));
    }
}
