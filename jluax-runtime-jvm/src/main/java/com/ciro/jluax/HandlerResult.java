package com.ciro.jluax;

import com.ciro.jluax.render.ResponseKind;

/**
 * Lo que devolvió un handler, ya convertido a valores Java
 * (String, Number, Boolean, List, Map o null).
 */
public record HandlerResult(int status, Object payload, ResponseKind kind) {}
