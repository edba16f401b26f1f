package com.example.sourcesync.api.request;

import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class ResolveFailureRequest {

    @Size(max = 1000)
    private String notes;
}
