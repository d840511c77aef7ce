package com.ciro.livepatch.standalone;

import com.ciro.livepatch.PatchContext;

/**
 * Página registrada por la aplicación. Devuelve el HTML del cuerpo y puede dejar trabajo en
 * marcha (timers, contenido diferido) que más tarde parchea la página vía {@code ctx}.
 */
@FunctionalInterface
public interface Page {

    String render(PatchContext ctx) throws Exception;
}
