/**
 * Runtime core of the Objection server-driven UI protocol.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Path addressing: {@link io.objection.core.Symbol}, {@link io.objection.core.EventPath}
 *       and the hex/binary {@link io.objection.core.SymbolCodec}</li>
 *   <li>Typed keys: {@link io.objection.core.EventKey} and {@link io.objection.core.ActionKey}</li>
 *   <li>Per-event state: {@link io.objection.core.SessionRoot} with its
 *       {@link io.objection.core.Client} and {@link io.objection.core.Ui} views</li>
 *   <li>Batch dispatch: {@link io.objection.core.RequestDispatcher}</li>
 * </ul>
 *
 * <p>JSON handling goes through {@code io.objection.json.spi}; HTTP or WebSocket bindings live elsewhere.
 */
package io.objection.core;
