/** Formatting helpers shared by the process lifecycle and its error messages. */
package com.phillippitts.commandkit.util;
