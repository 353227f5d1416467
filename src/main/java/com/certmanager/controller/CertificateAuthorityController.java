package com.certmanager.controller;

import com.certmanager.model.CaCreateRequest;
import com.certmanager.model.CaSignCsrRequest;
import com.certmanager.model.CertificateUpdateRequest;
import com.certmanager.model.CertificateView;
import com.certmanager.service.CertificateAuthorityService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/certificateauthority")
public class CertificateAuthorityController {

    @Autowired
    private CertificateAuthorityService authorityService;

    @GetMapping
    public List<CertificateView> query() {
        return authorityService.query();
    }

    @GetMapping("/{id}")
    public CertificateView get(@PathVariable Long id) {
        return authorityService.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CertificateView create(@RequestBody CaCreateRequest request) {
        log.info("Certificate authority create request: {} ({})", request.getName(),
                request.getClass().getSimpleName());
        return authorityService.create(request);
    }

    @PutMapping("/{id}")
    public CertificateView update(@PathVariable Long id, @RequestBody CertificateUpdateRequest request) {
        return authorityService.update(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        authorityService.delete(id);
    }

    @PostMapping("/ca_sign_csr")
    @ResponseStatus(HttpStatus.CREATED)
    public CertificateView signCsr(@RequestBody CaSignCsrRequest request) {
        return authorityService.signCsr(request);
    }
}
