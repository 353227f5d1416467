package com.certmanager.model;

import com.certmanager.crypto.SubjectInfo;

import java.util.ArrayList;
import java.util.List;

public interface SubjectRequest {
    Integer getKeyLength();

    String getDigestAlgorithm();

    String getCountry();

    String getState();

    String getCity();

    String getOrganization();

    String getOrganizationalUnit();

    String getCommon();

    String getEmail();

    List<String> getSan();

    default SubjectInfo toSubjectInfo() {
        return SubjectInfo.builder()
                .country(getCountry())
                .state(getState())
                .city(getCity())
                .organization(getOrganization())
                .organizationalUnit(getOrganizationalUnit())
                .common(getCommon())
                .email(getEmail())
                .san(getSan() == null ? new ArrayList<>() : new ArrayList<>(getSan()))
                .build();
    }
}
