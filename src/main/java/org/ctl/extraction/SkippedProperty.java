package org.ctl.extraction;

/**
 * Diagnostica di una voce scartata.
 *
 * @param position indice della voce nel documento
 * @param id identificativo, null se era proprio l'id a mancare
 * @param reason motivo dello scarto
 * @param detail messaggio descrittivo
 */
public record SkippedProperty(int position, String id, SkipReason reason, String detail) {
}
