/**
 * Host resource sampling and the admission policy built on top of it.
 *
 * @see io.qoms.resource.ResourceMonitor
 * @see io.qoms.resource.AdmissionPolicy
 * @see io.qoms.resource.SystemResourceSampler
 */
package io.qoms.resource;
