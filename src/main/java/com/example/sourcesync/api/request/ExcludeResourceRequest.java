package com.example.sourcesync.api.request;

import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class ExcludeResourceRequest {

    @Size(max = 1000)
    private String notes;
}
