package com.certmanager.crypto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubjectInfo {
    private String country;
    private String state;
    private String city;
    private String organization;
    private String organizationalUnit;
    private String common;
    private String email;
    @Builder.Default
    private List<String> san = new ArrayList<>();
}
