package com.example.valuelens.provider;

import java.util.Map;

/**
 * A provider that can report its current reachability for the diagnostics endpoint.
 */
public interface DiagnosableProvider {

    String getProviderName();

    Map<String, Object> probe();
}
