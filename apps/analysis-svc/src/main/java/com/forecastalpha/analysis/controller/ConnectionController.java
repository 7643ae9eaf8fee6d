package com.forecastalpha.analysis.controller;

import com.forecastalpha.analysis.controller.dto.ConnectionRequestDto;
import com.forecastalpha.analysis.controller.dto.ConnectionResponseDto;
import com.forecastalpha.analysis.controller.dto.TablesResponseDto;
import com.forecastalpha.analysis.datasource.ConnectionDescriptor;
import com.forecastalpha.analysis.datasource.ConnectionService;
import com.forecastalpha.analysis.datasource.ConnectionUrlBuilder;
import com.forecastalpha.analysis.datasource.UnknownConnectionException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Validated
public class ConnectionController {

    private static final String DEFAULT_DRIVER = "mysql";
    private static final int DEFAULT_PORT = 3306;

    private final ConnectionService connectionService;

    public ConnectionController(ConnectionService connectionService) {
        this.connectionService = connectionService;
    }

    @PostMapping("/connect")
    public ResponseEntity<ConnectionResponseDto> connect(@Valid @RequestBody ConnectionRequestDto request) {
        String connectionId = connectionService.connect(toDescriptor(request));
        return ResponseEntity.ok(new ConnectionResponseDto("success", connectionId));
    }

    @GetMapping("/tables")
    public ResponseEntity<TablesResponseDto> listTables(@RequestParam("connection_id") @NotBlank String connectionId) {
        TablesResponseDto response = new TablesResponseDto(
                "success",
                connectionService.listTables(connectionId).stream()
                        .map(table -> new TablesResponseDto.TableDto(table.name(), table.columns()))
                        .toList()
        );
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/connections/{connectionId}")
    public ResponseEntity<Void> disconnect(@PathVariable("connectionId") String connectionId) {
        if (!connectionService.disconnect(connectionId)) {
            throw new UnknownConnectionException(connectionId);
        }
        return ResponseEntity.noContent().build();
    }

    private ConnectionDescriptor toDescriptor(ConnectionRequestDto request) {
        if (request.jdbcUrl() != null && !request.jdbcUrl().isBlank()) {
            return new ConnectionDescriptor(request.jdbcUrl().trim(), request.username(), request.password());
        }
        String driver = request.driver() == null || request.driver().isBlank() ? DEFAULT_DRIVER : request.driver();
        int port = request.port() == null ? DEFAULT_PORT : request.port();
        Map<String, String> options = new LinkedHashMap<>();
        if (request.options() != null) {
            options.putAll(request.options());
        }
        if (Boolean.TRUE.equals(request.ssl())) {
            applySsl(driver, options);
        }
        String url = ConnectionUrlBuilder.build(driver, request.host(), port, request.database(), options);
        return new ConnectionDescriptor(url, request.username(), request.password());
    }

    private static void applySsl(String driver, Map<String, String> options) {
        if (driver.trim().toLowerCase().startsWith("postgresql")) {
            options.putIfAbsent("sslmode", "require");
        } else {
            options.putIfAbsent("useSSL", "true");
        }
    }
}
