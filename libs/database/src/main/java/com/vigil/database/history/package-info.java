/** JDBC implementation of the agent history store. */
package com.vigil.database.history;
