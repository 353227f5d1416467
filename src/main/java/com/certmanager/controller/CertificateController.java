package com.certmanager.controller;

import com.certmanager.model.CertificateCreateRequest;
import com.certmanager.model.CertificateUpdateRequest;
import com.certmanager.model.CertificateView;
import com.certmanager.model.RenewalReport;
import com.certmanager.service.AcmeIssuanceService;
import com.certmanager.service.CertificateService;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/certificate")
public class CertificateController {

    @Autowired
    private CertificateService certificateService;

    @Autowired
    private AcmeIssuanceService acmeIssuanceService;

    @GetMapping
    public List<CertificateView> query() {
        return certificateService.query();
    }

    @GetMapping("/{id}")
    public CertificateView get(@PathVariable Long id) {
        return certificateService.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CertificateView create(@RequestBody CertificateCreateRequest request) {
        log.info("Certificate create request: {} ({})", request.getName(), request.getClass().getSimpleName());
        return certificateService.create(request);
    }

    @PutMapping("/{id}")
    public CertificateView update(@PathVariable Long id, @RequestBody CertificateUpdateRequest request) {
        return certificateService.update(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id, @RequestParam(defaultValue = "false") boolean force) {
        certificateService.delete(id, force);
    }

    @GetMapping("/{id}/fingerprint")
    public Map<String, String> fingerprint(@PathVariable Long id) {
        return Collections.singletonMap("fingerprint", certificateService.fingerprint(id));
    }

    @GetMapping("/acme_server_choices")
    public Map<String, String> acmeServerChoices() {
        return certificateService.acmeServerChoices();
    }

    @PostMapping("/renew")
    public RenewalReport renew() {
        return acmeIssuanceService.renew();
    }
}
