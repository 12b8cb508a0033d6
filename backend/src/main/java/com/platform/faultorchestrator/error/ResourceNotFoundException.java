package com.platform.faultorchestrator.error;

/**
 * Exception for missing resources.
 */
public class ResourceNotFoundException extends FaultOrchestratorException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException activeFault(String faultKind) {
        return new ResourceNotFoundException(ErrorCode.FAULT_NOT_ACTIVE, "Active fault", faultKind);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
