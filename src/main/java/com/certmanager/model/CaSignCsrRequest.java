package com.certmanager.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CaSignCsrRequest {
    private Long caId;
    private Long csrCertId;
    private String name;
}
