/**
 * Output strategies applied once per folder after its conversion loop: replace originals in
 * place, or build a ZIP/CBZ archive next to the folder. Exactly one strategy is active per run.
 *
 * @since 1.0
 */
package com.phillippitts.webpbatch.service.output;
