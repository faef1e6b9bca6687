package io.vena.modelsync;

import org.slf4j.MDC;

import static io.vena.modelsync.MdcKeys.MODEL_ID;
import static io.vena.modelsync.MdcKeys.SESSION_ID;

final class MappedDiagnosticContext {

	static MDCScope setupMDC(int modelID, int sessionID) {
		MDCScope result = new MDCScope();
		MDC.put(MODEL_ID, Integer.toString(modelID));
		MDC.put(SESSION_ID, Integer.toString(sessionID));
		return result;
	}

	/**
	 * This is like {@link org.slf4j.MDC.MDCCloseable} except instead of
	 * deleting the MDC entry at the end, it restores it to its prior value,
	 * which allows us to nest these. A reset runs a merge, for example.
	 *
	 * <p>
	 * Use this in a try block that has no catch or finally clause;
	 * those would run after {@link #close()} and miss the context.
	 */
	static final class MDCScope implements AutoCloseable {
		final String oldModelID = MDC.get(MODEL_ID);
		final String oldSessionID = MDC.get(SESSION_ID);

		@Override public void close() {
			restore(MODEL_ID, oldModelID);
			restore(SESSION_ID, oldSessionID);
		}

		private static void restore(String key, String oldValue) {
			if (oldValue == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, oldValue);
			}
		}
	}

}
