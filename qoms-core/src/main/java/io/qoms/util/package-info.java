/**
 * Small concurrency helpers.
 */
package io.qoms.util;
