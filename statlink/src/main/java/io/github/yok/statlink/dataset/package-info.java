/**
 * {@link org.dbunit.dataset.ITable} decorators reshaping parsed datasets before loading.
 */
package io.github.yok.statlink.dataset;
