package com.frontline.model;

/**
 * An entity that owns a resource balance managed by the ledger.
 */
public interface ResourceHolder {

    String getId();

    int getResources();

    void setResources(int resources);
}
