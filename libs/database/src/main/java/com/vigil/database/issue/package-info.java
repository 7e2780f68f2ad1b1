/** JDBC implementation of the issue store. */
package com.vigil.database.issue;
