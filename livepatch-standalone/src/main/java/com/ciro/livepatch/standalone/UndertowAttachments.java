package com.ciro.livepatch.standalone;

import io.undertow.util.AttachmentKey;

public final class UndertowAttachments {
    private UndertowAttachments() {}

    /** Id de sesión resuelto para este request (cookie existente o recién creada). */
    public static final AttachmentKey<String> SESSION_ID = AttachmentKey.create(String.class);

    /** Presente cuando la cookie de sesión se emitió en esta misma respuesta. */
    public static final AttachmentKey<Boolean> SESSION_CREATED = AttachmentKey.create(Boolean.class);
}
