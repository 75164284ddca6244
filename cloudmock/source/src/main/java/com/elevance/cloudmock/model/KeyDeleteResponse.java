package com.elevance.cloudmock.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyDeleteResponse {
    private boolean found;
    private boolean invalidated;
}
