package io.vena.modelsync;

import java.util.Map;

/**
 * Chooses which of a model's sessions is authoritative.
 *
 * <p>
 * Offline sessions never qualify.
 * Sessions from the official broadcasting software outrank all others;
 * within either class, the highest session ID wins.
 */
final class BestSessionSelector {
	static final int NO_SESSION = 0;

	/**
	 * @return the ID of the best session, or {@link #NO_SESSION} if none qualifies
	 */
	static int bestSessionId(Map<Integer, Session> sessions) {
		int best = NO_SESSION;
		boolean foundOfficial = false;
		for (Map.Entry<Integer, Session> entry: sessions.entrySet()) {
			Session session = entry.getValue();
			if (session.isOffline()) {
				continue;
			}
			int sessionId = entry.getKey();
			if (session.isOfficialSoftware()) {
				if (!foundOfficial) {
					foundOfficial = true;
					best = sessionId;
				} else if (sessionId > best) {
					best = sessionId;
				}
			} else if (!foundOfficial && sessionId > best) {
				best = sessionId;
			}
		}
		return best;
	}

	private BestSessionSelector() { }
}
