package com.certmanager.service;

public interface ServiceReloadHook {
    void reload();
}
