/**
 * Value types shared across the scheduler: item lifecycle states and resource snapshots.
 *
 * @see io.qoms.model.ItemStatus
 * @see io.qoms.model.ResourceSnapshot
 */
package io.qoms.model;
