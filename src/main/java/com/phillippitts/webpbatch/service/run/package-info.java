/**
 * Run orchestration: the sequential {@link com.phillippitts.webpbatch.service.run.RunCoordinator},
 * cooperative cancellation, and the service that starts runs in the background and tracks the
 * latest {@link com.phillippitts.webpbatch.service.run.RunSnapshot}.
 *
 * <p>All outbound notifications are Spring application events from the {@code event}
 * sub-package. For a given run id they arrive in this order: any number of status and
 * progress events, one {@code RunCompletedEvent}, then one {@code RunFinishedEvent}.
 *
 * @since 1.0
 */
package com.phillippitts.webpbatch.service.run;
