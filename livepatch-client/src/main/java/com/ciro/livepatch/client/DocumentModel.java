package com.ciro.livepatch.client;

/**
 * Lo mínimo del DOM que necesita el reconciliador: buscar un nodo por id y aplicarle
 * HTML según el modo de swap.
 *
 * <p>Las llamadas llegan siempre desde el mismo hilo del cliente.
 */
public interface DocumentModel {

    boolean contains(String id);

    /** Reemplaza el contenido del nodo. */
    void setInner(String id, String html);

    /** Reemplaza el nodo completo por el HTML dado. */
    void replaceNode(String id, String html);

    void append(String id, String html);

    void prepend(String id, String html);

    /** Recarga completa pedida por el servidor. */
    void reload();
}
