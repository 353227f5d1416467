package com.certmanager.controller;

import com.certmanager.entity.CertificateType;
import com.certmanager.exception.AcmeTimeoutException;
import com.certmanager.exception.PolicyViolationException;
import com.certmanager.exception.RecordNotFoundException;
import com.certmanager.exception.ValidationException;
import com.certmanager.model.CertificateCreateRequest;
import com.certmanager.model.CertificateView;
import com.certmanager.model.Issuer;
import com.certmanager.service.AcmeIssuanceService;
import com.certmanager.service.CertificateService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CertificateController.class)
class CertificateControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CertificateService certificateService;

    @MockBean
    private AcmeIssuanceService acmeIssuanceService;

    @Test
    void testCreateDispatchesOnCreateType() throws Exception {
        when(certificateService.create(any(CertificateCreateRequest.class))).thenReturn(CertificateView.builder()
                .id(1L)
                .name("web")
                .type(CertificateType.CERT_CSR)
                .issuer(Issuer.signaturePending())
                .serial(BigInteger.ONE)
                .build());

        mockMvc.perform(post("/api/certificate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"create_type\":\"CERTIFICATE_CREATE_CSR\",\"name\":\"web\",\"key_length\":2048,"
                                + "\"digest_algorithm\":\"SHA256\",\"country\":\"US\",\"common\":\"www.example.com\","
                                + "\"san\":[\"www.example.com\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("web"))
                .andExpect(jsonPath("$.issuer").value("external - signature pending"));

        ArgumentCaptor<CertificateCreateRequest> captor = ArgumentCaptor.forClass(CertificateCreateRequest.class);
        verify(certificateService).create(captor.capture());
        CertificateCreateRequest.Csr request = (CertificateCreateRequest.Csr) captor.getValue();
        assertEquals(2048, request.getKeyLength());
        assertEquals(Collections.singletonList("www.example.com"), request.getSan());
    }

    @Test
    void testPassthroughVariantIsNotAccepted() throws Exception {
        mockMvc.perform(post("/api/certificate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"create_type\":\"CERTIFICATE_CREATE\",\"name\":\"x\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testValidationErrorsAreListedPerField() throws Exception {
        when(certificateService.create(any(CertificateCreateRequest.class)))
                .thenThrow(ValidationException.of("certificate_create.name", "A certificate with this name already exists"));

        mockMvc.perform(post("/api/certificate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"create_type\":\"CERTIFICATE_CREATE_IMPORTED\",\"name\":\"dup\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0].field").value("certificate_create.name"))
                .andExpect(jsonPath("$.errors[0].message").value("A certificate with this name already exists"));
    }

    @Test
    void testUnknownCertificateIsNotFound() throws Exception {
        when(certificateService.get(42L)).thenThrow(new RecordNotFoundException("Certificate", 42L));

        mockMvc.perform(get("/api/certificate/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Certificate 42 does not exist"));
    }

    @Test
    void testDeleteForwardsForceFlag() throws Exception {
        mockMvc.perform(delete("/api/certificate/7").param("force", "true"))
                .andExpect(status().isNoContent());

        verify(certificateService).delete(7L, true);
    }

    @Test
    void testDeletingServingCertificateIsRefused() throws Exception {
        doThrow(new PolicyViolationException("certificate_delete.id", "in use"))
                .when(certificateService).delete(eq(1L), eq(false));

        mockMvc.perform(delete("/api/certificate/1"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0].field").value("certificate_delete.id"));
    }

    @Test
    void testAcmeTimeoutMapsToGatewayTimeout() throws Exception {
        when(certificateService.create(any(CertificateCreateRequest.class)))
                .thenThrow(new AcmeTimeoutException("Certificate request for final order timed out"));

        mockMvc.perform(post("/api/certificate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"create_type\":\"CERTIFICATE_CREATE_ACME\",\"name\":\"acme\",\"csr_id\":3,"
                                + "\"acme_directory_uri\":\"https://acme.example.test/directory\",\"tos\":true,"
                                + "\"dns_mapping\":{\"www.example.com\":1}}"))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void testAcmeServerChoices() throws Exception {
        when(certificateService.acmeServerChoices()).thenReturn(Collections.singletonMap(
                "https://acme-v02.api.letsencrypt.org/directory", "Let's Encrypt Production Directory"));

        mockMvc.perform(get("/api/certificate/acme_server_choices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['https://acme-v02.api.letsencrypt.org/directory']")
                        .value("Let's Encrypt Production Directory"));
    }
}
