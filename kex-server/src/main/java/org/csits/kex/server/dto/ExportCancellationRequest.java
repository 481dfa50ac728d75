package org.csits.kex.server.dto;

import lombok.Data;

@Data
public class ExportCancellationRequest {

    private String jobId;
}
