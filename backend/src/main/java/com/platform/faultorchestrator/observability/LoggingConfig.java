package com.platform.faultorchestrator.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation IDs for requests and fault context for recovery work.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_FAULT_KIND = "faultKind";
    public static final String MDC_FAULT_ID = "faultId";
    
    @Value("${spring.application.name:fault-orchestrator}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.putProperty("application", applicationName);
        }
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";
        private static final String MDC_REQUEST_PATH = "requestPath";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                MDC.put(MDC_REQUEST_PATH, request.getRequestURI());
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_REQUEST_PATH);
            }
        }
    }
    
    /**
     * Set fault information in MDC for logging.
     */
    public static void setFaultContext(String faultKind, String faultId) {
        MDC.put(MDC_FAULT_KIND, faultKind);
        if (faultId != null) {
            MDC.put(MDC_FAULT_ID, faultId);
        }
    }
    
    /**
     * Clear fault context from MDC.
     */
    public static void clearFaultContext() {
        MDC.remove(MDC_FAULT_KIND);
        MDC.remove(MDC_FAULT_ID);
    }
}
