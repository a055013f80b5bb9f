/**
 ** -----------------------------------------------------------------------------**
 ** EProperties.java
 **
 ** Properties with typed lookups, used for denoise configuration files
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EProperties.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */
package com.elphel.denoise.common;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

public class EProperties extends Properties{
	private static final long serialVersionUID = 3191527440864021367L;

	public static EProperties load(Path path) throws IOException {
		EProperties properties = new EProperties();
		try (InputStream is = Files.newInputStream(path)) {
			properties.load(is);
		}
		return properties;
	}

	public void store(Path path, String comments) throws IOException {
		try (OutputStream os = Files.newOutputStream(path)) {
			store(os, comments);
		}
	}

	public int getProperty(String key, int value){
		String s = getProperty(key);
		return (s == null) ? value : Integer.parseInt(s.trim());
	}
	public double getProperty(String key, double value){
		String s = getProperty(key);
		return (s == null) ? value : Double.parseDouble(s.trim());
	}
	public boolean getProperty(String key, boolean value){
		String s = getProperty(key);
		return (s == null) ? value : Boolean.parseBoolean(s.trim());
	}
}
