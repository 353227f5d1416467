package com.certmanager.controller;

import com.certmanager.entity.DnsAuthenticatorEntity;
import com.certmanager.service.DnsAuthenticatorService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/acme/dns/authenticator")
public class DnsAuthenticatorController {

    @Autowired
    private DnsAuthenticatorService authenticatorService;

    @GetMapping
    public List<DnsAuthenticatorEntity> query() {
        return authenticatorService.query();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DnsAuthenticatorEntity create(@RequestBody DnsAuthenticatorEntity authenticator) {
        return authenticatorService.create(authenticator);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        authenticatorService.delete(id);
    }
}
