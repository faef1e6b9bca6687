package io.vena.modelsync;

final class MdcKeys {
	static final String MODEL_ID   = "modelsync.modelID";
	static final String SESSION_ID = "modelsync.sessionID";
}
