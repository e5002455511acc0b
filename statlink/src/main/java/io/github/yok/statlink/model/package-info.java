/**
 * Entity record instances: declared values plus the system versioning columns.
 */
package io.github.yok.statlink.model;
