/**
 * Image Harvester core package.
 *
 * <p>
 * Contains the resumable work-unit pipeline: the checkpoint store, the content ledger used
 * for deduplication and the credential rotator, together with the HTTP collaborators
 * that feed them.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.harvester;

import org.jspecify.annotations.NullMarked;
