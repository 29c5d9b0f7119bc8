package com.payment.processing.api;

import com.payment.processing.core.TerminalService;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.provider.ConnectionTokenResult;
import com.payment.processing.domain.provider.TerminalPairingRequest;
import com.payment.processing.domain.provider.TerminalResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Card-present terminal pairing. Rejections from the network are returned as 400 with the network's code.
 */
@RestController
@RequestMapping("/api/v1/orgs/{orgId}/terminals")
@RequiredArgsConstructor
@Tag(name = "Payment terminals", description = "Pair card readers with a card network")
public class TerminalController {

    private final TerminalService terminalService;

    @PostMapping("/{terminalId}/pair")
    @Operation(summary = "Pair terminal", description = "Stripe needs registrationCode (and usually locationId); Adyen assigns terminalId to storeId.")
    public ResponseEntity<TerminalResponseDto> pair(@PathVariable UUID orgId,
                                                    @PathVariable String terminalId,
                                                    @Valid @RequestBody PairTerminalRequestDto dto) {
        TerminalPairingRequest request = TerminalPairingRequest.builder()
                .terminalId(terminalId)
                .registrationCode(dto.getRegistrationCode())
                .label(dto.getLabel() != null ? dto.getLabel() : "Terminal")
                .locationId(dto.getLocationId())
                .storeId(dto.getStoreId())
                .build();
        TerminalResult result = terminalService.pair(orgId, dto.getProcessor(), request);
        TerminalResponseDto body = TerminalResponseDto.from(terminalId, dto.getProcessor(), result);
        return result.isSuccess() ? ResponseEntity.ok(body) : ResponseEntity.badRequest().body(body);
    }

    @PostMapping("/{terminalId}/connection-token")
    @Operation(summary = "Create connection token", description = "Stripe Terminal SDK connection token for the reader's location.")
    public ResponseEntity<Map<String, Object>> connectionToken(@PathVariable UUID orgId,
                                                               @PathVariable String terminalId,
                                                               @RequestBody(required = false) ConnectionTokenRequestDto dto) {
        ConnectionTokenResult result = terminalService.connectionToken(orgId, ProcessorName.STRIPE,
                dto != null ? dto.getLocationId() : null);
        Map<String, Object> body = new LinkedHashMap<>();
        if (result.isSuccess()) {
            body.put("secret", result.getSecret());
            body.put("objectType", "terminal.connection_token");
            return ResponseEntity.ok(body);
        }
        body.put("error", result.getErrorCode());
        body.put("message", result.getErrorMessage());
        return ResponseEntity.badRequest().body(body);
    }
}
